package org.terrasim.core.service;

import org.terrasim.core.generation.GenerationPipeline;
import org.terrasim.core.generation.LoggingStageListener;
import org.terrasim.core.generation.SimulationMonitor;
import org.terrasim.core.generation.StageListener;
import org.terrasim.core.generation.StageProfile;
import org.terrasim.core.generation.WorldContext;
import org.terrasim.core.io.ClasspathAlgorithmSource;
import org.terrasim.core.model.config.GenerationConfig;
import org.terrasim.core.terrain.AlgorithmSource;
import org.terrasim.core.terrain.TerrainAlgorithmRegistry;

import java.util.Set;

public class PlanetGenerationService {

    public static final String TERRAIN_CATEGORY = "terrain";

    private final TerrainAlgorithmRegistry registry;   // грузится один раз

    public PlanetGenerationService(TerrainAlgorithmRegistry registry) {
        this.registry = registry;
    }

    public PlanetGenerationService(AlgorithmSource source) {
        this(TerrainAlgorithmRegistry.load(source, TERRAIN_CATEGORY));
    }

    /** Каталог из ресурсов: /algorithms/terrain.json */
    public static PlanetGenerationService withBundledAlgorithms() {
        return new PlanetGenerationService(new ClasspathAlgorithmSource());
    }

    public Set<String> algorithmNames() {
        return registry.names();
    }

    public WorldContext generate(GenerationConfig config) {
        return generate(config, new LoggingStageListener(), SimulationMonitor.NONE);
    }

    // каждый запуск - свой конвейер, состояние между запусками не делится
    public WorldContext generate(GenerationConfig config, StageListener listener, SimulationMonitor monitor) {
        GenerationPipeline pipeline = new GenerationPipeline(
                StageProfile.byName(config.profile), config.validation, listener, monitor);
        return pipeline.run(config, registry);
    }
}
