package org.terrasim.core.model.config;

import org.terrasim.core.topology.Vec3;

/**
 * Все ручки одного запуска генерации. Заполняется GenerationConfigLoader
 * (terrasim.properties + файл + -Dterrasim.*), проверяется при сборке
 * TerrainParameters / ClimateParameters.
 */
public class GenerationConfig {

    // --- Сетка ---
    public int gridLevel = 5;

    // --- Рельеф ---
    public String terrainAlgorithm = "default";
    public long terrainSeed = 1L;
    public int terrainOctaves = 6;
    /** метры */
    public double terrainMagnitude = 3000.0;
    public double terrainPersistence = 0.65;

    // --- Планета ---
    /** км */
    public double radiusKm = 6371.0;
    public double axisX = 0.0;
    public double axisY = 0.0;
    public double axisZ = 1.0;
    /** метры */
    public double seaLevel = 0.0;

    // --- Климат ---
    public double axialTiltDeg = 23.44;
    public double acceptableDelta = 0.05;
    public double precipitationFactor = 1.0;
    public double humidityHalfLifeDays = 10.0;
    public int seasonsPerCycle = 4;
    public int maxCycles = ClimateParameters.DEFAULT_MAX_CYCLES;

    // --- Пайплайн ---
    public String profile = "full";
    public boolean validation = true;

    public TerrainParameters terrainParameters() {
        return new TerrainParameters(terrainAlgorithm, terrainSeed, terrainOctaves, terrainMagnitude,
                terrainPersistence);
    }

    public ClimateParameters climateParameters() {
        return new ClimateParameters(axialTiltDeg, acceptableDelta, precipitationFactor, humidityHalfLifeDays,
                seasonsPerCycle, maxCycles);
    }

    public Vec3 rotationAxis() {
        Vec3 axis = new Vec3(axisX, axisY, axisZ);
        if (!(axis.length() > 0.0)) {
            throw new ConfigurationException("Rotation axis must be non-zero: " + axis);
        }
        return axis.normalize();
    }
}
