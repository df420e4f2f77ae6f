package org.terrasim.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.generation.stages.ClassifyStage;
import org.terrasim.core.generation.stages.ClimateStage;
import org.terrasim.core.generation.stages.GridStage;
import org.terrasim.core.generation.stages.PlanetStage;
import org.terrasim.core.generation.stages.RiverStage;
import org.terrasim.core.generation.stages.SeaLevelStage;
import org.terrasim.core.generation.stages.TerrainStage;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.model.config.GenerationConfig;
import org.terrasim.core.terrain.TerrainAlgorithmRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

public class GenerationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationPipeline.class);

    private final List<GenerationStage> stages = new ArrayList<>();
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;

    public GenerationPipeline(StageProfile profile,
                              boolean enableValidation,
                              StageListener listener,
                              SimulationMonitor monitor) {
        this.profile = profile;
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new LoggingStageListener();

        // Фиксируем порядок стадий
        stages.add(new GridStage());
        stages.add(new TerrainStage());
        stages.add(new PlanetStage());
        stages.add(new SeaLevelStage());
        stages.add(new RiverStage());
        stages.add(new ClimateStage(monitor));
        stages.add(new ClassifyStage());
    }

    /**
     * По умолчанию: все стадии, валидации включены, лог через SLF4J.
     */
    public GenerationPipeline() {
        this(StageProfile.full(), true, new LoggingStageListener(), SimulationMonitor.NONE);
    }

    public WorldContext run(GenerationConfig config, TerrainAlgorithmRegistry registry) {
        WorldContext ctx = new WorldContext(config, registry);

        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                listener.onStageSkipped(stage.id(), stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                ctx = stage.apply(ctx);

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (ConfigurationException | ClimateNonConvergenceException | CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new IllegalStateException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }

        if (ctx.hasPlanet()) {
            WorldStats stats = WorldStats.compute(ctx.planet(), ctx.hasTerrain() ? ctx.terrainTypes() : null);
            WorldStatsReport.log(stats);
        } else {
            LOGGER.info("Profile {} produced no planet, stats skipped", profile.name());
        }
        return ctx;
    }

    private void runValidation(StageId id, WorldContext ctx) {
        switch (id) {
            case GRID -> Validation.afterGrid(ctx);
            case TERRAIN -> Validation.afterTerrain(ctx);
            case SEA_LEVEL -> Validation.afterSeaLevel(ctx);
            case RIVERS -> Validation.afterRivers(ctx);
            case CLIMATE -> Validation.afterClimate(ctx);
            default -> {
                // PLANET, CLASSIFY: без проверок
            }
        }
    }
}
