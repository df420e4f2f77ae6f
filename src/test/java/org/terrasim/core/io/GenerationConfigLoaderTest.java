package org.terrasim.core.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.model.config.GenerationConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class GenerationConfigLoaderTest {

    @TempDir
    Path tmp;

    private Path write(String name, String content) throws IOException {
        Path file = tmp.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.ISO_8859_1));
        return file;
    }

    @Test
    @DisplayName("Classpath defaults are applied")
    void classpathDefaults() {
        GenerationConfig cfg = GenerationConfigLoader.load(null, new Properties(), Map.of());

        assertEquals(5, cfg.gridLevel);
        assertEquals("continents", cfg.terrainAlgorithm);
        assertEquals(6371.0, cfg.radiusKm, 0.0);
        assertEquals(4, cfg.seasonsPerCycle);
        assertEquals(200, cfg.maxCycles);
        assertEquals("full", cfg.profile);
        assertTrue(cfg.validation);
    }

    @Test
    @DisplayName("File from the environment overlays defaults, system properties win last")
    void layering() throws IOException {
        Path file = write("run.properties", "grid.level=3\nterrain.algorithm=archipelago\nplanet.seaLevel=120\n");
        Properties system = new Properties();
        system.setProperty("terrasim.grid.level", "4");
        system.setProperty("terrasim.climate.axialTiltDeg", "0");
        system.setProperty("unrelated.key", "x");

        GenerationConfig cfg = GenerationConfigLoader.load(null, system, Map.of("TERRASIM_CONFIG_PATH", file.toString()));

        assertEquals(4, cfg.gridLevel);
        assertEquals("archipelago", cfg.terrainAlgorithm);
        assertEquals(120.0, cfg.seaLevel, 0.0);
        assertEquals(0.0, cfg.axialTiltDeg, 0.0);
    }

    @Test
    @DisplayName("System property path beats the environment, explicit path beats both")
    void pathResolution() throws IOException {
        Path fromEnv = write("env.properties", "terrain.seed=1\n");
        Path fromProp = write("prop.properties", "terrain.seed=2\n");
        Path explicit = write("explicit.properties", "terrain.seed=3\n");
        Properties system = new Properties();
        system.setProperty("terrasim.config.path", fromProp.toString());
        Map<String, String> env = Map.of("TERRASIM_CONFIG_PATH", fromEnv.toString());

        assertEquals(2L, GenerationConfigLoader.load(null, system, env).terrainSeed);
        assertEquals(3L, GenerationConfigLoader.load(explicit, system, env).terrainSeed);
    }

    @Test
    @DisplayName("Malformed values and missing files are configuration errors")
    void malformed() throws IOException {
        Path badNumber = write("bad.properties", "planet.radiusKm=big\n");
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> GenerationConfigLoader.load(badNumber, new Properties(), Map.of()));
        assertTrue(e.getMessage().contains("planet.radiusKm"), e.getMessage());

        Path badBool = write("bool.properties", "pipeline.validation=maybe\n");
        assertThrows(ConfigurationException.class,
                () -> GenerationConfigLoader.load(badBool, new Properties(), Map.of()));

        assertThrows(ConfigurationException.class,
                () -> GenerationConfigLoader.load(tmp.resolve("nope.properties"), new Properties(), Map.of()));
    }

    @Test
    @DisplayName("Loaded values feed the validated parameter objects")
    void parameterObjects() throws IOException {
        Path file = write("zero.properties", "climate.seasonsPerCycle=0\n");
        GenerationConfig cfg = GenerationConfigLoader.load(file, new Properties(), Map.of());
        assertThrows(ConfigurationException.class, cfg::climateParameters);

        cfg.seasonsPerCycle = 4;
        assertEquals(4, cfg.climateParameters().seasonsPerCycle);
        assertEquals("continents", cfg.terrainParameters().name);
    }
}
