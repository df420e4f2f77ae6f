package org.terrasim.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Климат одного сезона для всех тайлов.
 *
 * Единицы: insolation - Вт/м^2 (среднесуточно), temperature - K,
 * humidity - мм осаждаемой воды, precipitation - кг/м^2/сутки (= мм/сутки),
 * snow - мм водного эквивалента, leafAreaIndex - 0..10.
 */
public final class SeasonClimate {

    private final int season;
    private final double[] insolation;
    private final double[] temperature;
    private final double[] humidity;
    private final double[] precipitation;
    private final double[] snow;
    private final double[] leafAreaIndex;

    public SeasonClimate(int season,
                         double[] insolation,
                         double[] temperature,
                         double[] humidity,
                         double[] precipitation,
                         double[] snow,
                         double[] leafAreaIndex) {
        int n = insolation.length;
        if (temperature.length != n || humidity.length != n || precipitation.length != n
                || snow.length != n || leafAreaIndex.length != n) {
            throw new IllegalArgumentException("Season field sizes differ");
        }
        this.season = season;
        this.insolation = insolation.clone();
        this.temperature = temperature.clone();
        this.humidity = humidity.clone();
        this.precipitation = precipitation.clone();
        this.snow = snow.clone();
        this.leafAreaIndex = leafAreaIndex.clone();
    }

    /** Нейтральное стартовое состояние: все поля нулевые. */
    public static SeasonClimate zero(int season, int tileCount) {
        double[] z = new double[tileCount];
        return new SeasonClimate(season, z, z, z, z, z, z);
    }

    public int season() {
        return season;
    }

    public int tileCount() {
        return insolation.length;
    }

    public double insolation(int tile) {
        return insolation[Objects.checkIndex(tile, insolation.length)];
    }

    public double temperature(int tile) {
        return temperature[Objects.checkIndex(tile, temperature.length)];
    }

    public double humidity(int tile) {
        return humidity[Objects.checkIndex(tile, humidity.length)];
    }

    public double precipitation(int tile) {
        return precipitation[Objects.checkIndex(tile, precipitation.length)];
    }

    public double snow(int tile) {
        return snow[Objects.checkIndex(tile, snow.length)];
    }

    public double leafAreaIndex(int tile) {
        return leafAreaIndex[Objects.checkIndex(tile, leafAreaIndex.length)];
    }

    /** Максимальная абсолютная разница по всем тайлам и всем шести полям. */
    public double maxDifference(SeasonClimate other) {
        if (other.tileCount() != tileCount()) {
            throw new IllegalArgumentException("Tile count mismatch: " + tileCount() + " vs " + other.tileCount());
        }
        double max = 0.0;
        max = Math.max(max, maxAbsDiff(insolation, other.insolation));
        max = Math.max(max, maxAbsDiff(temperature, other.temperature));
        max = Math.max(max, maxAbsDiff(humidity, other.humidity));
        max = Math.max(max, maxAbsDiff(precipitation, other.precipitation));
        max = Math.max(max, maxAbsDiff(snow, other.snow));
        max = Math.max(max, maxAbsDiff(leafAreaIndex, other.leafAreaIndex));
        return max;
    }

    private static double maxAbsDiff(double[] a, double[] b) {
        double max = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = Math.abs(a[i] - b[i]);
            // NaN никогда не считаем сошедшимся
            if (Double.isNaN(d)) return Double.POSITIVE_INFINITY;
            if (d > max) max = d;
        }
        return max;
    }

    @Override
    public String toString() {
        return "SeasonClimate{season=" + season + ", tiles=" + tileCount()
                + ", tempRange=" + Arrays.stream(temperature).min().orElse(Double.NaN)
                + ".." + Arrays.stream(temperature).max().orElse(Double.NaN) + "}";
    }
}
