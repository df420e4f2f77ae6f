package org.terrasim.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorMainTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Small run from a config file exits with 0")
    void smallRun() throws IOException {
        Path file = tmp.resolve("small.properties");
        Files.write(file, "grid.level=1\nterrain.algorithm=default\npipeline.profile=upToRivers\n"
                .getBytes(StandardCharsets.ISO_8859_1));

        assertEquals(0, GeneratorMain.run(new String[]{file.toString()}));
    }

    @Test
    @DisplayName("Configuration problems exit with 2")
    void configurationError() {
        assertEquals(2, GeneratorMain.run(new String[]{tmp.resolve("missing.properties").toString()}));
    }
}
