package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.PlanetFactory;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.WorldContext;

public class SeaLevelStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.SEA_LEVEL;
    }

    @Override
    public String name() {
        return "Sea level";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        return ctx.withPlanet(PlanetFactory.seaLevel(ctx.planet(), ctx.config().seaLevel));
    }
}
