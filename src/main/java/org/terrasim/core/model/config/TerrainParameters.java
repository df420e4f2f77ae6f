package org.terrasim.core.model.config;

/**
 * Настройки именованного алгоритма рельефа.
 * magnitude - амплитуда возмущения в метрах, persistence - затухание по октавам.
 */
public final class TerrainParameters {

    public final String name;
    public final long seed;
    public final int octaveCount;
    public final double magnitude;
    public final double persistence;

    public TerrainParameters(String name, long seed, int octaveCount, double magnitude, double persistence) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Terrain algorithm name is empty");
        }
        if (octaveCount < 0) {
            throw new ConfigurationException("octaveCount must be >= 0: " + octaveCount);
        }
        if (!(magnitude >= 0.0) || Double.isInfinite(magnitude)) {
            throw new ConfigurationException("magnitude must be finite and >= 0: " + magnitude);
        }
        if (!(persistence > 0.0) || Double.isInfinite(persistence)) {
            throw new ConfigurationException("persistence must be finite and > 0: " + persistence);
        }
        this.name = name.trim();
        this.seed = seed;
        this.octaveCount = octaveCount;
        this.magnitude = magnitude;
        this.persistence = persistence;
    }

    @Override
    public String toString() {
        return "TerrainParameters{name=" + name + ", seed=" + seed + ", octaves=" + octaveCount
                + ", magnitude=" + magnitude + ", persistence=" + persistence + "}";
    }
}
