package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.PlanetFactory;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.WorldContext;

public class PlanetStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.PLANET;
    }

    @Override
    public String name() {
        return "Heightmap to planet";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        return ctx.withPlanet(PlanetFactory.fromHeightmap(ctx.finestGrid(), ctx.heightmap(),
                ctx.config().radiusKm, ctx.config().rotationAxis()));
    }
}
