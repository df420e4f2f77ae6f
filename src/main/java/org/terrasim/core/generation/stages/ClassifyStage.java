package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.TerrainClassifier;
import org.terrasim.core.generation.WorldContext;

public class ClassifyStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.CLASSIFY;
    }

    @Override
    public String name() {
        return "Terrain types";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        return ctx.withTerrain(new TerrainClassifier().classifyAll(ctx.planet()));
    }
}
