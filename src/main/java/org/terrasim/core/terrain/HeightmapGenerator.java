package org.terrasim.core.terrain;

import org.terrasim.core.topology.Grid;

import java.util.List;
import java.util.Random;

/**
 * Сферический аналог midpoint displacement.
 *
 * Уровень 0: magnitude * u для каждого из 12 тайлов.
 * Уровень l: новый тайл = среднее двух родителей + magnitude * persistence^l * u,
 * пока l <= octaves; дальше только интерполяция. Старые тайлы не трогаем.
 * u равномерно в [-1, 1), один Random(seed) на весь проход в порядке id.
 */
public class HeightmapGenerator {

    private final long seed;
    private final int octaves;
    private final double magnitude;
    private final double persistence;

    public HeightmapGenerator(long seed, int octaves, double magnitude, double persistence) {
        this.seed = seed;
        this.octaves = octaves;
        this.magnitude = magnitude;
        this.persistence = persistence;
    }

    public double[] generate(List<Grid> grids) {
        Random random = new Random(seed);

        Grid base = grids.get(0);
        double[] elevation = new double[base.tileCount()];
        for (int t = 0; t < elevation.length; t++) {
            elevation[t] = magnitude * signed(random);
        }

        for (int l = 1; l < grids.size(); l++) {
            Grid grid = grids.get(l);
            double amplitude = (l <= octaves) ? magnitude * Math.pow(persistence, l) : 0.0;

            double[] refined = new double[grid.tileCount()];
            System.arraycopy(elevation, 0, refined, 0, elevation.length);
            for (int t = grid.previousTileCount(); t < refined.length; t++) {
                int[] parents = grid.tileParents(t);
                double mean = 0.5 * (elevation[parents[0]] + elevation[parents[1]]);
                double noise = signed(random);
                refined[t] = mean + amplitude * noise;
            }
            elevation = refined;
        }
        return elevation;
    }

    private static double signed(Random random) {
        return random.nextDouble() * 2.0 - 1.0;
    }
}
