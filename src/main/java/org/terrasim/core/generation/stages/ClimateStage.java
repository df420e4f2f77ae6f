package org.terrasim.core.generation.stages;

import org.terrasim.core.generation.ClimateSimulator;
import org.terrasim.core.generation.GenerationStage;
import org.terrasim.core.generation.SimulationMonitor;
import org.terrasim.core.generation.StageId;
import org.terrasim.core.generation.WorldContext;
import org.terrasim.core.model.ClimateState;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.config.ClimateParameters;

public class ClimateStage implements GenerationStage {

    private final SimulationMonitor monitor;

    public ClimateStage(SimulationMonitor monitor) {
        this.monitor = (monitor != null) ? monitor : SimulationMonitor.NONE;
    }

    @Override
    public StageId id() {
        return StageId.CLIMATE;
    }

    @Override
    public String name() {
        return "Seasonal climate";
    }

    @Override
    public WorldContext apply(WorldContext ctx) {
        ClimateParameters params = ctx.config().climateParameters();
        Planet planet = ctx.planet();
        ClimateState state = new ClimateSimulator().singularClimate(planet, params, monitor);
        return ctx.withPlanet(planet.withClimate(params, state));
    }
}
