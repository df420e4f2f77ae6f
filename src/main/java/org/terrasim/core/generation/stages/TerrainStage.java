package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.WorldContext;
import org.terrasim.core.model.config.TerrainParameters;
import org.terrasim.core.terrain.TerrainContext;
import org.terrasim.core.terrain.TerrainExpression;

public class TerrainStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.TERRAIN;
    }

    @Override
    public String name() {
        return "Terrain";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        TerrainParameters params = ctx.config().terrainParameters();
        TerrainExpression algorithm = ctx.registry().get(params.name);
        double[] heightmap = algorithm.evaluate(new TerrainContext(ctx.grids(), params));
        return ctx.withHeightmap(heightmap);
    }
}
