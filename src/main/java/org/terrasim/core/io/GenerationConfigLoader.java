package org.terrasim.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.model.config.GenerationConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Порядок: classpath terrasim.properties -> файл (terrasim.config.path /
 * TERRASIM_CONFIG_PATH или явный путь) -> отдельные -Dterrasim.&lt;key&gt;.
 */
public final class GenerationConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/terrasim.properties";
    static final String PATH_PROPERTY = "terrasim.config.path";
    static final String PATH_ENV = "TERRASIM_CONFIG_PATH";
    static final String OVERRIDE_PREFIX = "terrasim.";

    private GenerationConfigLoader() {
    }

    public static GenerationConfig load() {
        return load(null, System.getProperties(), System.getenv());
    }

    /** Явный файл (аргумент командной строки) важнее terrasim.config.path. */
    public static GenerationConfig load(Path file) {
        return load(file, System.getProperties(), System.getenv());
    }

    static GenerationConfig load(Path explicitFile, Properties system, Map<String, String> env) {
        GenerationConfig cfg = new GenerationConfig();

        Properties defaults = new Properties();
        try (InputStream in = GenerationConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                defaults.load(in);
            } else {
                LOGGER.warn("Classpath resource {} not found, using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        apply(defaults, cfg, "classpath:" + DEFAULTS_RESOURCE);

        Path path = explicitFile != null ? explicitFile : resolvePath(system, env);
        if (path != null) {
            if (!Files.exists(path)) {
                throw new ConfigurationException("Config file not found: " + path.toAbsolutePath());
            }
            Properties file = new Properties();
            try (InputStream in = Files.newInputStream(path)) {
                file.load(in);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read config: " + path.toAbsolutePath(), e);
            }
            apply(file, cfg, path.toString());
        }

        Properties overrides = new Properties();
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(OVERRIDE_PREFIX) && !name.equals(PATH_PROPERTY)) {
                overrides.setProperty(name.substring(OVERRIDE_PREFIX.length()), system.getProperty(name));
            }
        }
        apply(overrides, cfg, "system properties");

        LOGGER.info("Config: level={} algorithm={} seed={} radiusKm={} seaLevel={} profile={}",
                cfg.gridLevel, cfg.terrainAlgorithm, cfg.terrainSeed, cfg.radiusKm, cfg.seaLevel, cfg.profile);
        return cfg;
    }

    static void apply(Properties props, GenerationConfig cfg, String origin) {
        cfg.gridLevel = intValue(props, "grid.level", cfg.gridLevel, origin);

        cfg.terrainAlgorithm = pick(props.getProperty("terrain.algorithm"), cfg.terrainAlgorithm);
        cfg.terrainSeed = longValue(props, "terrain.seed", cfg.terrainSeed, origin);
        cfg.terrainOctaves = intValue(props, "terrain.octaves", cfg.terrainOctaves, origin);
        cfg.terrainMagnitude = doubleValue(props, "terrain.magnitude", cfg.terrainMagnitude, origin);
        cfg.terrainPersistence = doubleValue(props, "terrain.persistence", cfg.terrainPersistence, origin);

        cfg.radiusKm = doubleValue(props, "planet.radiusKm", cfg.radiusKm, origin);
        cfg.axisX = doubleValue(props, "planet.axis.x", cfg.axisX, origin);
        cfg.axisY = doubleValue(props, "planet.axis.y", cfg.axisY, origin);
        cfg.axisZ = doubleValue(props, "planet.axis.z", cfg.axisZ, origin);
        cfg.seaLevel = doubleValue(props, "planet.seaLevel", cfg.seaLevel, origin);

        cfg.axialTiltDeg = doubleValue(props, "climate.axialTiltDeg", cfg.axialTiltDeg, origin);
        cfg.acceptableDelta = doubleValue(props, "climate.acceptableDelta", cfg.acceptableDelta, origin);
        cfg.precipitationFactor = doubleValue(props, "climate.precipitationFactor", cfg.precipitationFactor, origin);
        cfg.humidityHalfLifeDays = doubleValue(props, "climate.humidityHalfLifeDays", cfg.humidityHalfLifeDays, origin);
        cfg.seasonsPerCycle = intValue(props, "climate.seasonsPerCycle", cfg.seasonsPerCycle, origin);
        cfg.maxCycles = intValue(props, "climate.maxCycles", cfg.maxCycles, origin);

        cfg.profile = pick(props.getProperty("pipeline.profile"), cfg.profile);
        String validation = pick(props.getProperty("pipeline.validation"));
        if (validation != null) {
            if (!validation.equalsIgnoreCase("true") && !validation.equalsIgnoreCase("false")) {
                throw new ConfigurationException("Malformed boolean for 'pipeline.validation' in " + origin
                        + ": " + validation);
            }
            cfg.validation = Boolean.parseBoolean(validation);
        }
    }

    private static Path resolvePath(Properties system, Map<String, String> env) {
        String override = pick(system.getProperty(PATH_PROPERTY), env.get(PATH_ENV));
        return override == null ? null : Paths.get(override);
    }

    private static int intValue(Properties props, String key, int current, String origin) {
        String raw = pick(props.getProperty(key));
        if (raw == null) return current;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Malformed integer for '" + key + "' in " + origin + ": " + raw, e);
        }
    }

    private static long longValue(Properties props, String key, long current, String origin) {
        String raw = pick(props.getProperty(key));
        if (raw == null) return current;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Malformed integer for '" + key + "' in " + origin + ": " + raw, e);
        }
    }

    private static double doubleValue(Properties props, String key, double current, String origin) {
        String raw = pick(props.getProperty(key));
        if (raw == null) return current;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Malformed number for '" + key + "' in " + origin + ": " + raw, e);
        }
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
