package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.RiverGenerator;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.WorldContext;

public class RiverStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.RIVERS;
    }

    @Override
    public String name() {
        return "Rivers";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        return ctx.withPlanet(new RiverGenerator().generate(ctx.planet()));
    }
}
