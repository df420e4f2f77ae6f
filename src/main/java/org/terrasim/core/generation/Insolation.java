package org.terrasim.core.generation;

/**
 * Среднесуточная инсоляция на верхней границе атмосферы, Вт/м^2.
 */
public final class Insolation {

    public static final double SOLAR_CONSTANT = 1361.0;

    /** Сколько фаз орбиты берём для среднегодового значения. */
    static final int ANNUAL_SAMPLES = 48;

    private Insolation() {}

    /**
     * @param latitude   широта тайла, радианы
     * @param axialTilt  наклон оси, радианы
     * @param phase      фаза орбиты theta, радианы (0 - равноденствие)
     */
    public static double dailyMean(double latitude, double axialTilt, double phase) {
        double declination = Math.asin(Math.sin(axialTilt) * Math.sin(phase));
        double sinLat = Math.sin(latitude);
        double cosLat = Math.cos(latitude);
        double sinDec = Math.sin(declination);
        double cosDec = Math.cos(declination);

        // часовой угол заката; полярный день/ночь - обрезаем
        double cosH0 = -Math.tan(latitude) * Math.tan(declination);
        double h0;
        if (cosH0 >= 1.0) {
            h0 = 0.0;
        } else if (cosH0 <= -1.0) {
            h0 = Math.PI;
        } else {
            h0 = Math.acos(cosH0);
        }

        double q = SOLAR_CONSTANT / Math.PI * (h0 * sinLat * sinDec + cosLat * cosDec * Math.sin(h0));
        return Math.max(0.0, q);
    }

    public static double annualMean(double latitude, double axialTilt) {
        double sum = 0.0;
        for (int i = 0; i < ANNUAL_SAMPLES; i++) {
            sum += dailyMean(latitude, axialTilt, 2.0 * Math.PI * i / ANNUAL_SAMPLES);
        }
        return sum / ANNUAL_SAMPLES;
    }

    public static double phase(int season, int seasonsPerCycle) {
        return 2.0 * Math.PI * season / seasonsPerCycle;
    }
}
