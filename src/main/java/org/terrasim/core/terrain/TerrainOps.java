package org.terrasim.core.terrain;

/**
 * Чистые операции над полями высот. Входные массивы не меняются.
 */
public final class TerrainOps {

    private TerrainOps() {}

    /**
     * elevation-lower: сдвигает поле вниз на threshold,
     * всё что было ниже порога становится отрицательным.
     */
    public static double[] elevationLower(double threshold, double[] field) {
        double[] out = new double[field.length];
        for (int i = 0; i < field.length; i++) {
            out[i] = field[i] - threshold;
        }
        return out;
    }

    /**
     * Горы добавляются только там, где и континент, и гора строго выше нуля,
     * иначе остаётся континент.
     */
    public static double[] overlay(double[] continent, double[] mountain) {
        if (continent.length != mountain.length) {
            throw new IllegalArgumentException("Field size mismatch: continent=" + continent.length
                    + " mountain=" + mountain.length);
        }
        double[] out = new double[continent.length];
        for (int i = 0; i < continent.length; i++) {
            double c = continent[i];
            double m = mountain[i];
            out[i] = (m > 0.0 && c > 0.0) ? c + m : c;
        }
        return out;
    }

    public static double[] scale(double factor, double[] field) {
        double[] out = new double[field.length];
        for (int i = 0; i < field.length; i++) {
            out[i] = field[i] * factor;
        }
        return out;
    }
}
