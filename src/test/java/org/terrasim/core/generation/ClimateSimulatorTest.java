package org.terrasim.core.generation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.terrasim.core.model.ClimateState;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.SeasonClimate;
import org.terrasim.core.model.config.ClimateParameters;
import org.terrasim.core.terrain.HeightmapGenerator;
import org.terrasim.core.topology.Grid;
import org.terrasim.core.topology.GridBuilder;
import org.terrasim.core.topology.Vec3;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClimateSimulatorTest {

    private final ClimateSimulator simulator = new ClimateSimulator();

    private static Planet uniform(int level, double elevation) {
        Grid grid = new GridBuilder().build(level);
        double[] h = new double[grid.tileCount()];
        Arrays.fill(h, elevation);
        return PlanetFactory.fromHeightmap(grid, h, 6371.0, Vec3.UNIT_Z);
    }

    @Test
    @DisplayName("Uniform dry land converges on the second cycle")
    void uniformLandConverges() {
        Planet planet = uniform(1, 0.0);
        ClimateParameters params = new ClimateParameters(0.0, 1e-9, 1.0, 10.0, 1);

        ClimateState state = simulator.singularClimate(planet, params);

        assertEquals(2, state.cycles());
        assertEquals(0.0, state.lastDelta(), 0.0);
        assertEquals(1, state.seasonCount());
        SeasonClimate s = state.season(0);
        for (int t = 0; t < planet.tileCount(); t++) {
            assertEquals(0.0, s.humidity(t), 0.0);
            assertEquals(0.0, s.precipitation(t), 0.0);
            assertTrue(s.temperature(t) > 0.0);
        }
    }

    @Test
    @DisplayName("Without tilt, tiles at the same absolute latitude get the same temperature")
    void symmetricPlanet() {
        Planet planet = uniform(0, 100.0);
        ClimateParameters params = new ClimateParameters(0.0, 1e-6, 1.0, 10.0, 4);

        ClimateState state = simulator.singularClimate(planet, params);

        for (SeasonClimate s : state.seasons()) {
            assertEquals(s.temperature(0), s.temperature(1), 1e-6, "poles");
            for (int t = 3; t < 12; t++) {
                assertEquals(s.temperature(2), s.temperature(t), 1e-6, "ring tile " + t);
            }
            assertTrue(s.temperature(2) > s.temperature(0), "ring is warmer than the pole");
        }
        // без наклона все сезоны одинаковы
        assertEquals(0.0, state.season(0).maxDifference(state.season(2)), 1e-9);
    }

    @Test
    @DisplayName("Realistic planet converges within the cap and keeps fields in range")
    void heightmapPlanetConverges() {
        List<Grid> grids = new GridBuilder().buildSequence(3);
        double[] h = new HeightmapGenerator(17L, 6, 3000.0, 0.65).generate(grids);
        Planet planet = PlanetFactory.fromHeightmap(grids.get(3), h, 6371.0, Vec3.UNIT_Z);
        ClimateParameters params = new ClimateParameters(23.44, 0.05, 1.0, 10.0, 4);

        ClimateState state = simulator.singularClimate(planet, params);

        assertTrue(state.cycles() >= 2 && state.cycles() < params.maxCycles);
        assertTrue(state.lastDelta() < 0.05);
        assertEquals(4, state.seasonCount());
        for (SeasonClimate s : state.seasons()) {
            for (int t = 0; t < planet.tileCount(); t++) {
                assertTrue(s.humidity(t) >= 0.0);
                assertTrue(s.precipitation(t) >= 0.0);
                assertTrue(s.snow(t) >= 0.0);
                assertTrue(s.leafAreaIndex(t) >= 0.0 && s.leafAreaIndex(t) <= 10.0);
                if (planet.isOcean(t)) {
                    assertEquals(0.0, s.leafAreaIndex(t), 0.0);
                    assertTrue(s.humidity(t) > 0.0 || s.precipitation(t) > 0.0);
                }
            }
        }
    }

    @Test
    @DisplayName("Exceeding the cycle cap reports non-convergence with the last cycle")
    void nonConvergence() {
        Grid grid = new GridBuilder().build(1);
        double[] h = new double[grid.tileCount()];
        for (int t = 0; t < h.length; t++) {
            h[t] = t % 2 == 0 ? -1000.0 : 100.0;
        }
        Planet planet = PlanetFactory.fromHeightmap(grid, h, 6371.0, Vec3.UNIT_Z);
        ClimateParameters params = new ClimateParameters(23.44, 1e-12, 1.0, 10.0, 4, 2);

        ClimateNonConvergenceException e = assertThrows(ClimateNonConvergenceException.class,
                () -> simulator.singularClimate(planet, params));

        assertEquals(2, e.cycles());
        assertTrue(e.lastDelta() >= 1e-12);
        assertNotNull(e.bestEffort());
        assertEquals(4, e.bestEffort().seasonCount());
    }

    @Test
    @DisplayName("Monitor sees every cycle and can cancel between seasons")
    void monitorAndCancel() {
        Planet planet = uniform(0, 0.0);
        ClimateParameters params = new ClimateParameters(0.0, 1e-9, 1.0, 10.0, 2);

        SimulationMonitor monitor = mock(SimulationMonitor.class);
        simulator.singularClimate(planet, params, monitor);
        InOrder order = inOrder(monitor);
        order.verify(monitor).onCycle(eq(1), eq(Double.POSITIVE_INFINITY));
        order.verify(monitor).onCycle(eq(2), eq(0.0));

        SimulationMonitor cancelling = mock(SimulationMonitor.class);
        when(cancelling.isCancelled()).thenReturn(false, false, true);
        assertThrows(CancellationException.class, () -> simulator.singularClimate(planet, params, cancelling));
        verify(cancelling).onCycle(anyInt(), anyDouble());

        SimulationMonitor immediate = mock(SimulationMonitor.class);
        when(immediate.isCancelled()).thenReturn(true);
        assertThrows(CancellationException.class, () -> simulator.singularClimate(planet, params, immediate));
        verify(immediate, never()).onCycle(anyInt(), anyDouble());
    }

    @Test
    @DisplayName("Higher land is colder by the lapse rate")
    void lapseRate() {
        ClimateParameters params = new ClimateParameters(23.44, 0.05, 1.0, 10.0, 4);
        Planet low = uniform(1, 0.0);
        Planet high = uniform(1, 1000.0);
        SeasonClimate zero = SeasonClimate.zero(3, low.tileCount());

        SeasonClimate a = simulator.next(low, params, zero, 0);
        SeasonClimate b = simulator.next(high, params, zero, 0);

        for (int t = 0; t < low.tileCount(); t++) {
            assertEquals(a.temperature(t) - 6.5, b.temperature(t), 1e-9);
        }
    }

    @Test
    @DisplayName("Ocean has a smaller seasonal temperature swing than land")
    void oceanInertia() {
        ClimateParameters params = new ClimateParameters(23.44, 0.05, 1.0, 10.0, 4);
        Planet land = uniform(1, 10.0);
        Planet ocean = uniform(1, -10.0);
        SeasonClimate zero = SeasonClimate.zero(3, land.tileCount());

        double landSwing = swing(land, params, zero);
        double oceanSwing = swing(ocean, params, zero);

        assertTrue(oceanSwing < landSwing, "ocean " + oceanSwing + " vs land " + landSwing);
    }

    private double swing(Planet planet, ClimateParameters params, SeasonClimate zero) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int s = 0; s < params.seasonsPerCycle; s++) {
            double t = simulator.next(planet, params, zero, s).temperature(0);
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        return max - min;
    }

    @Test
    @DisplayName("Humidity carry-over decays with the half-life")
    void humidityDecay() {
        Planet planet = uniform(0, 0.0);
        int n = planet.tileCount();
        double[] zeros = new double[n];
        double[] wet = new double[n];
        Arrays.fill(wet, 1.0);
        SeasonClimate previous = new SeasonClimate(0, zeros, zeros, wet, zeros, zeros, zeros);

        ClimateParameters params = new ClimateParameters(0.0, 0.05, 1.0, 2.0, 365);
        double seasonDays = ClimateSimulator.YEAR_DAYS / 365;
        SeasonClimate next = simulator.next(planet, params, previous, 1);

        // суша без осадков и листвы: источник 0, остаётся только перенос
        double carried = Math.pow(0.5, seasonDays / 2.0);
        for (int t = 0; t < n; t++) {
            double total = next.humidity(t) + next.precipitation(t) * seasonDays;
            assertEquals(carried, total, 1e-9);
        }
    }

    @Test
    @DisplayName("Season and tile count are checked")
    void badArguments() {
        Planet planet = uniform(0, 0.0);
        ClimateParameters params = new ClimateParameters(0.0, 0.05, 1.0, 10.0, 4);
        assertThrows(IllegalArgumentException.class,
                () -> simulator.next(planet, params, SeasonClimate.zero(0, 12), 4));
        assertThrows(IllegalArgumentException.class,
                () -> simulator.next(planet, params, SeasonClimate.zero(0, 42), 0));
    }
}
