package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.WorldContext;
import org.terrasim.core.topology.GridBuilder;

public class GridStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.GRID;
    }

    @Override
    public String name() {
        return "Grid";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        return ctx.withGrids(new GridBuilder().buildSequence(ctx.config().gridLevel));
    }
}
