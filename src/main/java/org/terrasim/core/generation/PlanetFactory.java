package org.terrasim.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.topology.Grid;
import org.terrasim.core.topology.Vec3;

/**
 * heightmap -> planet и сдвиг уровня моря.
 */
public final class PlanetFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanetFactory.class);

    private PlanetFactory() {}

    /**
     * Привязывает сырое поле высот (м) к радиусу (км) и оси вращения.
     * Площадь тайла = сумма сферических треугольников (центр, угол k, угол k+1).
     */
    public static Planet fromHeightmap(Grid grid, double[] elevation, double radiusKm, Vec3 axis) {
        if (!(radiusKm > 0.0) || Double.isInfinite(radiusKm)) {
            throw new ConfigurationException("Planet radius must be finite and > 0: " + radiusKm);
        }
        if (axis == null || !(axis.length() > 0.0)) {
            throw new ConfigurationException("Rotation axis must be non-zero: " + axis);
        }
        if (elevation.length != grid.tileCount()) {
            throw new IllegalArgumentException("Heightmap size " + elevation.length
                    + " != tileCount " + grid.tileCount());
        }

        double r2 = radiusKm * radiusKm;
        double[] area = new double[grid.tileCount()];
        TileLoops.forEachIndex(grid.tileCount(), t -> area[t] = unitArea(grid, t) * r2);

        Planet planet = new Planet(grid, radiusKm, axis.normalize(), 0.0, elevation, area);
        LOGGER.debug("Planet constructed: tiles={} radiusKm={}", planet.tileCount(), radiusKm);
        return planet;
    }

    /**
     * Новый ноль = target: из каждого тайла вычитается target, seaLevel копится.
     * Суша <=> высота >= 0.
     */
    public static Planet seaLevel(Planet planet, double target) {
        if (Double.isNaN(target) || Double.isInfinite(target)) {
            throw new ConfigurationException("Sea level must be finite: " + target);
        }
        double[] shifted = planet.elevationField();
        for (int t = 0; t < shifted.length; t++) {
            shifted[t] -= target;
        }
        Planet result = planet.withElevation(planet.seaLevel() + target, shifted);

        int land = 0;
        for (int t = 0; t < result.tileCount(); t++) {
            if (result.isLand(t)) land++;
        }
        LOGGER.info("Sea level shifted by {} m: land tiles={} ocean tiles={}",
                target, land, result.tileCount() - land);
        return result;
    }

    private static double unitArea(Grid grid, int tile) {
        Vec3 center = grid.tileCenter(tile);
        int m = grid.tileEdgeCount(tile);
        double sum = 0.0;
        for (int k = 0; k < m; k++) {
            Vec3 b = grid.cornerPosition(grid.tileCorner(tile, k));
            Vec3 c = grid.cornerPosition(grid.tileCorner(tile, (k + 1) % m));
            sum += sphericalTriangle(center, b, c);
        }
        return sum;
    }

    // tan(E/2) = |a.(b x c)| / (1 + a.b + b.c + c.a), единичная сфера
    static double sphericalTriangle(Vec3 a, Vec3 b, Vec3 c) {
        double numerator = Math.abs(a.dot(b.cross(c)));
        double denominator = 1.0 + a.dot(b) + b.dot(c) + c.dot(a);
        return 2.0 * Math.atan2(numerator, denominator);
    }
}
