package org.terrasim.core.model.config;

/**
 * Параметры одного прогона климата. Не меняются до конца симуляции.
 */
public final class ClimateParameters {

    public static final int DEFAULT_MAX_CYCLES = 200;

    /** градусы */
    public final double axialTiltDeg;
    /** допуск сходимости: max |разница| одного сезона между двумя циклами */
    public final double acceptableDelta;
    public final double precipitationFactor;
    public final double humidityHalfLifeDays;
    public final int seasonsPerCycle;
    /** жёсткий лимит числа годовых циклов */
    public final int maxCycles;

    public ClimateParameters(double axialTiltDeg,
                             double acceptableDelta,
                             double precipitationFactor,
                             double humidityHalfLifeDays,
                             int seasonsPerCycle) {
        this(axialTiltDeg, acceptableDelta, precipitationFactor, humidityHalfLifeDays, seasonsPerCycle,
                DEFAULT_MAX_CYCLES);
    }

    public ClimateParameters(double axialTiltDeg,
                             double acceptableDelta,
                             double precipitationFactor,
                             double humidityHalfLifeDays,
                             int seasonsPerCycle,
                             int maxCycles) {
        if (Double.isNaN(axialTiltDeg) || axialTiltDeg < -90.0 || axialTiltDeg > 90.0) {
            throw new ConfigurationException("axialTiltDeg must be within [-90, 90]: " + axialTiltDeg);
        }
        if (!(acceptableDelta > 0.0)) {
            throw new ConfigurationException("acceptableDelta must be > 0: " + acceptableDelta);
        }
        if (!(precipitationFactor > 0.0) || Double.isInfinite(precipitationFactor)) {
            throw new ConfigurationException("precipitationFactor must be finite and > 0: " + precipitationFactor);
        }
        if (!(humidityHalfLifeDays > 0.0)) {
            throw new ConfigurationException("humidityHalfLifeDays must be > 0: " + humidityHalfLifeDays);
        }
        if (seasonsPerCycle <= 0) {
            throw new ConfigurationException("seasonsPerCycle must be > 0: " + seasonsPerCycle);
        }
        if (maxCycles < 2) {
            throw new ConfigurationException("maxCycles must be >= 2: " + maxCycles);
        }
        this.axialTiltDeg = axialTiltDeg;
        this.acceptableDelta = acceptableDelta;
        this.precipitationFactor = precipitationFactor;
        this.humidityHalfLifeDays = humidityHalfLifeDays;
        this.seasonsPerCycle = seasonsPerCycle;
        this.maxCycles = maxCycles;
    }

    @Override
    public String toString() {
        return "ClimateParameters{tilt=" + axialTiltDeg + ", delta=" + acceptableDelta
                + ", precipFactor=" + precipitationFactor + ", humidityHalfLife=" + humidityHalfLifeDays
                + ", seasons=" + seasonsPerCycle + ", maxCycles=" + maxCycles + "}";
    }
}
