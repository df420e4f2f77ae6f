package org.terrasim.core.terrain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import org.terrasim.core.model.config.TerrainParameters;
import org.terrasim.core.topology.GridBuilder;

import static org.junit.jupiter.api.Assertions.*;

class TerrainOpsTest {

    @Test
    @DisplayName("Mountain adds relief only where both fields are positive")
    void overlayConditionalAdd() {
        double[] continent = {100.0, 100.0, -50.0, 0.0, 100.0, -20.0};
        double[] mountain = {30.0, -30.0, 30.0, 30.0, 0.0, -5.0};

        double[] result = TerrainOps.overlay(continent, mountain);

        assertArrayEquals(new double[]{130.0, 100.0, -50.0, 0.0, 100.0, -20.0}, result, 0.0);
    }

    @Test
    @DisplayName("Overlay of two hand-picked fields on the 12-tile base grid")
    void overlayOnBaseGrid() {
        double[] continent = {500.0, -200.0, 0.0, 1200.0, 30.0, -1.0, 800.0, 250.0, -3000.0, 10.0, 0.5, 700.0};
        double[] mountain = {100.0, 400.0, 900.0, -50.0, 0.0, -7.0, 2000.0, 0.25, 300.0, 1.0, 99.5, -700.0};
        TerrainContext ctx = new TerrainContext(new GridBuilder().buildSequence(0),
                new TerrainParameters("base", 1L, 0, 0.0, 0.5));
        assertEquals(12, ctx.tileCount());

        TerrainExpression overlay = TerrainExpressions.overlay(c -> continent.clone(), c -> mountain.clone());
        double[] result = overlay.evaluate(ctx);

        assertArrayEquals(new double[]{
                600.0, -200.0, 0.0, 1200.0, 30.0, -1.0, 2800.0, 250.25, -3000.0, 11.0, 100.0, 700.0
        }, result, 0.0);
    }

    @Test
    @DisplayName("Overlay does not modify its inputs")
    void overlayIsPure() {
        double[] continent = {1.0, 2.0};
        double[] mountain = {3.0, 4.0};
        TerrainOps.overlay(continent, mountain);
        assertArrayEquals(new double[]{1.0, 2.0}, continent, 0.0);
        assertArrayEquals(new double[]{3.0, 4.0}, mountain, 0.0);
    }

    @Test
    @DisplayName("Fields of different size are rejected")
    void overlaySizeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> TerrainOps.overlay(new double[3], new double[4]));
    }

    @Test
    @DisplayName("elevation-lower shifts values under the threshold to <= 0")
    void elevationLower() {
        double[] result = TerrainOps.elevationLower(40.0, new double[]{50.0, 40.0, 10.0, -5.0});
        assertArrayEquals(new double[]{10.0, 0.0, -30.0, -45.0}, result, 1e-12);
    }

    @Test
    @DisplayName("Scale multiplies every tile")
    void scale() {
        assertArrayEquals(new double[]{-2.0, 0.0, 5.0}, TerrainOps.scale(0.5, new double[]{-4.0, 0.0, 10.0}), 1e-12);
    }
}
