package org.terrasim.core.generation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.topology.Grid;
import org.terrasim.core.topology.GridBuilder;
import org.terrasim.core.topology.Vec3;

import static org.junit.jupiter.api.Assertions.*;

class PlanetFactoryTest {

    private final Grid grid = new GridBuilder().build(3);

    @Test
    @DisplayName("Tile areas sum to the sphere surface")
    void areaSumsToSphere() {
        double radius = 6371.0;
        Planet planet = PlanetFactory.fromHeightmap(grid, new double[grid.tileCount()], radius, Vec3.UNIT_Z);

        double total = 0.0;
        for (int t = 0; t < planet.tileCount(); t++) {
            assertTrue(planet.area(t) > 0.0);
            total += planet.area(t);
        }
        double sphere = 4.0 * Math.PI * radius * radius;
        assertEquals(sphere, total, sphere * 1e-9);
    }

    @Test
    @DisplayName("Pentagons are smaller than the average hexagon")
    void pentagonArea() {
        Planet planet = PlanetFactory.fromHeightmap(grid, new double[grid.tileCount()], 1.0, Vec3.UNIT_Z);
        double mean = 4.0 * Math.PI / grid.tileCount();
        assertTrue(planet.area(0) < mean);
    }

    @Test
    @DisplayName("Radius and axis are validated, axis is normalized")
    void validation() {
        double[] h = new double[grid.tileCount()];
        assertThrows(ConfigurationException.class, () -> PlanetFactory.fromHeightmap(grid, h, 0.0, Vec3.UNIT_Z));
        assertThrows(ConfigurationException.class, () -> PlanetFactory.fromHeightmap(grid, h, -5.0, Vec3.UNIT_Z));
        assertThrows(ConfigurationException.class,
                () -> PlanetFactory.fromHeightmap(grid, h, 100.0, new Vec3(0, 0, 0)));
        assertThrows(IllegalArgumentException.class,
                () -> PlanetFactory.fromHeightmap(grid, new double[3], 100.0, Vec3.UNIT_Z));

        Planet planet = PlanetFactory.fromHeightmap(grid, h, 100.0, new Vec3(0, 0, 5));
        assertEquals(1.0, planet.rotationAxis().length(), 1e-12);
        assertEquals(Math.PI / 2, planet.latitude(0), 1e-12);
    }

    @Test
    @DisplayName("Sea level subtracts the target from every tile and classifies land/ocean")
    void seaLevelShift() {
        double[] h = new double[grid.tileCount()];
        for (int t = 0; t < h.length; t++) {
            h[t] = t % 2 == 0 ? 150.0 : 50.0;
        }
        Planet raw = PlanetFactory.fromHeightmap(grid, h, 6371.0, Vec3.UNIT_Z);

        Planet shifted = PlanetFactory.seaLevel(raw, 100.0);

        assertEquals(100.0, shifted.seaLevel(), 0.0);
        for (int t = 0; t < h.length; t++) {
            assertEquals(h[t] - 100.0, shifted.elevation(t), 1e-12);
            assertEquals(t % 2 == 0, shifted.isLand(t));
            assertEquals(raw.area(t), shifted.area(t), 0.0);
        }
        // исходная планета не изменилась
        assertEquals(150.0, raw.elevation(0), 0.0);

        Planet twice = PlanetFactory.seaLevel(shifted, -50.0);
        assertEquals(50.0, twice.seaLevel(), 1e-12);
        assertEquals(100.0, twice.elevation(0), 1e-12);
    }

    @Test
    @DisplayName("Elevation exactly at zero is land")
    void zeroIsLand() {
        Planet planet = PlanetFactory.seaLevel(
                PlanetFactory.fromHeightmap(grid, new double[grid.tileCount()], 1.0, Vec3.UNIT_Z), 0.0);
        assertTrue(planet.isLand(0));
        assertFalse(planet.hasRivers());
        assertFalse(planet.hasClimate());
        assertThrows(IllegalStateException.class, () -> planet.flowTarget(0));
        assertThrows(IllegalStateException.class, planet::climate);
    }
}
