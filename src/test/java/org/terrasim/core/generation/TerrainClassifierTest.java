package org.terrasim.core.generation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.terrasim.core.model.ClimateState;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.SeasonClimate;
import org.terrasim.core.model.TerrainType;
import org.terrasim.core.model.config.ClimateParameters;
import org.terrasim.core.topology.Grid;
import org.terrasim.core.topology.GridBuilder;
import org.terrasim.core.topology.Vec3;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TerrainClassifierTest {

    private static final Grid GRID = new GridBuilder().build(0);
    private final TerrainClassifier classifier = new TerrainClassifier();

    /** Один тайл (id 0) с заданной высотой и двумя сезонами климата; остальные - такие же. */
    private static Planet tile(double elevation, double[] temperature, double[] precipitation,
                               double[] snow, double[] lai) {
        int n = GRID.tileCount();
        double[] h = new double[n];
        Arrays.fill(h, elevation);
        Planet planet = PlanetFactory.fromHeightmap(GRID, h, 6371.0, Vec3.UNIT_Z);

        List<SeasonClimate> seasons = new ArrayList<>();
        for (int s = 0; s < temperature.length; s++) {
            seasons.add(new SeasonClimate(s, fill(n, 200.0), fill(n, temperature[s]), fill(n, 1.0),
                    fill(n, precipitation[s]), fill(n, snow[s]), fill(n, lai[s])));
        }
        ClimateParameters params = new ClimateParameters(23.44, 0.05, 1.0, 10.0, temperature.length);
        return planet.withClimate(params, new ClimateState(seasons, 3, 0.0));
    }

    private static double[] fill(int n, double v) {
        double[] a = new double[n];
        Arrays.fill(a, v);
        return a;
    }

    private static double[] pair(double a, double b) {
        return new double[]{a, b};
    }

    private TerrainType classify(double elevation, double[] t, double[] p, double[] snow, double[] lai) {
        return classifier.classify(tile(elevation, t, p, snow, lai), 0);
    }

    @Test
    @DisplayName("Ocean depth bands")
    void oceanBands() {
        double[] none = pair(0, 0);
        double[] warm = pair(290, 290);
        assertEquals(TerrainType.DEEP_OCEAN, classify(-4000, warm, none, none, none));
        assertEquals(TerrainType.MID_OCEAN, classify(-2000, warm, none, none, none));
        assertEquals(TerrainType.SURFACE_OCEAN, classify(-1, warm, none, none, none));
        assertTrue(TerrainType.MID_OCEAN.isOcean());
    }

    @Test
    @DisplayName("Always-wet lowland becomes swamp or marsh by vegetation")
    void wetlands() {
        double[] wet = pair(2.0, 3.0);
        double[] noSnow = pair(0, 0);
        double[] warm = pair(295, 300);
        assertEquals(TerrainType.SWAMP, classify(100, warm, wet, noSnow, pair(6.0, 6.0)));
        assertEquals(TerrainType.MARSH, classify(100, warm, wet, noSnow, pair(1.0, 2.0)));
        // круглый год под снегом - не болото
        assertNotEquals(TerrainType.MARSH, classify(100, pair(260, 265), pair(0, 0), pair(10, 10), pair(0, 0)));
    }

    @Test
    @DisplayName("Forest kind follows the seasonal LAI spread and warmth")
    void forests() {
        double[] dry = pair(1.0, 1.0);
        double[] noSnow = pair(0, 0);
        assertEquals(TerrainType.HEAVY_JUNGLE_FOREST,
                classify(100, pair(305, 306), dry, noSnow, pair(9.0, 9.5)));
        assertEquals(TerrainType.JUNGLE_FOREST,
                classify(100, pair(305, 306), dry, noSnow, pair(7.0, 7.5)));
        // мало колеблется, но холодно - тайга
        assertEquals(TerrainType.BOREAL_FOREST,
                classify(100, pair(270, 290), dry, noSnow, pair(6.5, 7.0)));
        assertEquals(TerrainType.MIXED_FOREST,
                classify(100, pair(275, 295), dry, noSnow, pair(0.5, 7.8)));
        assertEquals(TerrainType.HEAVY_DECIDUOUS_FOREST,
                classify(100, pair(275, 295), dry, noSnow, pair(0.0, 9.0)));
        assertEquals(TerrainType.HILL_BOREAL_FOREST,
                classify(600, pair(270, 290), dry, noSnow, pair(6.5, 7.0)));
        assertEquals(TerrainType.MOUNTAIN_JUNGLE_FOREST,
                classify(900, pair(305, 306), dry, noSnow, pair(9.0, 9.5)));
        assertEquals(TerrainType.Forest.BOREAL, TerrainType.HILL_BOREAL_FOREST.forest);
    }

    @Test
    @DisplayName("Bare mountains, snowy when frozen")
    void mountains() {
        double[] dry = pair(0.5, 0.5);
        assertEquals(TerrainType.MOUNTAIN, classify(1000, pair(275, 285), dry, pair(0, 0), pair(1, 2)));
        assertEquals(TerrainType.SNOW_MOUNTAIN, classify(1000, pair(250, 260), dry, pair(5, 0), pair(0, 0)));
        assertEquals(TerrainType.SNOW_MOUNTAIN, classify(1000, pair(275, 285), dry, pair(5, 5), pair(0, 0)));
    }

    @Test
    @DisplayName("Open land: savanna, grass and the desert family")
    void openLand() {
        double[] dry = pair(0.5, 0.5);
        double[] noSnow = pair(0, 0);
        assertEquals(TerrainType.SAVANNA, classify(100, pair(295, 300), dry, noSnow, pair(3, 6)));
        assertEquals(TerrainType.HILL_SAVANNA, classify(600, pair(295, 300), dry, noSnow, pair(3, 6)));
        assertEquals(TerrainType.GRASS, classify(100, pair(285, 295), dry, noSnow, pair(2, 5)));
        assertEquals(TerrainType.SAND_DESERT, classify(100, pair(290, 310), dry, noSnow, pair(0, 0)));
        assertEquals(TerrainType.SNOW_DESERT, classify(100, pair(260, 280), dry, noSnow, pair(0, 0)));
        assertEquals(TerrainType.DESERT, classify(100, pair(280, 295), dry, noSnow, pair(0, 0)));
    }

    @Test
    @DisplayName("classifyAll labels every tile")
    void classifyAll() {
        Planet planet = tile(100, pair(280, 295), pair(0.5, 0.5), pair(0, 0), pair(0, 0));
        TerrainType[] types = classifier.classifyAll(planet);
        assertEquals(planet.tileCount(), types.length);
        for (TerrainType type : types) {
            assertEquals(TerrainType.DESERT, type);
        }
    }

    @Test
    @DisplayName("Land classification needs a simulated climate")
    void needsClimate() {
        Planet planet = PlanetFactory.fromHeightmap(GRID, new double[GRID.tileCount()], 1.0, Vec3.UNIT_Z);
        assertThrows(IllegalStateException.class, () -> classifier.classify(planet, 0));
    }
}
