package org.terrasim.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.generation.ClimateNonConvergenceException;
import org.terrasim.core.generation.WorldContext;
import org.terrasim.core.io.GenerationConfigLoader;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.model.config.GenerationConfig;
import org.terrasim.core.service.PlanetGenerationService;

import java.nio.file.Paths;

/**
 * Запуск: java -jar terrasim-generator.jar [config.properties]
 * Отдельные ключи: -Dterrasim.grid.level=6 -Dterrasim.terrain.algorithm=continents ...
 */
public class GeneratorMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneratorMain.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        try {
            GenerationConfig config = args.length >= 1
                    ? GenerationConfigLoader.load(Paths.get(args[0]))
                    : GenerationConfigLoader.load();

            PlanetGenerationService service = PlanetGenerationService.withBundledAlgorithms();
            LOGGER.info("Terrain algorithms: {}", service.algorithmNames());

            long start = System.currentTimeMillis();
            WorldContext world = service.generate(config);
            if (world.hasPlanet()) {
                Planet planet = world.planet();
                LOGGER.info("Generated {} in {} ms", planet, System.currentTimeMillis() - start);
            }
            return 0;
        } catch (ConfigurationException e) {
            LOGGER.error("Configuration error: {}", e.getMessage());
            return 2;
        } catch (ClimateNonConvergenceException e) {
            LOGGER.error("{}", e.getMessage());
            return 3;
        } catch (RuntimeException e) {
            LOGGER.error("Generation failed", e);
            return 1;
        }
    }
}
