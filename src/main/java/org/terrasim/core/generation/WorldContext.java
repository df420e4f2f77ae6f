package org.terrasim.core.generation;

import org.terrasim.core.model.Planet;
import org.terrasim.core.model.TerrainType;
import org.terrasim.core.model.config.GenerationConfig;
import org.terrasim.core.terrain.TerrainAlgorithmRegistry;
import org.terrasim.core.topology.Grid;

import java.util.List;
import java.util.Objects;

/**
 * Состояние одного прогона. Неизменяемое: каждая стадия возвращает новую копию.
 * Поля, которые ещё не посчитаны, равны null.
 */
public final class WorldContext {

    private final GenerationConfig config;
    private final TerrainAlgorithmRegistry registry;
    private final List<Grid> grids;
    private final double[] heightmap;
    private final Planet planet;
    private final TerrainType[] terrain;

    public WorldContext(GenerationConfig config, TerrainAlgorithmRegistry registry) {
        this(Objects.requireNonNull(config, "config"), Objects.requireNonNull(registry, "registry"),
                null, null, null, null);
    }

    private WorldContext(GenerationConfig config,
                         TerrainAlgorithmRegistry registry,
                         List<Grid> grids,
                         double[] heightmap,
                         Planet planet,
                         TerrainType[] terrain) {
        this.config = config;
        this.registry = registry;
        this.grids = grids;
        this.heightmap = heightmap;
        this.planet = planet;
        this.terrain = terrain;
    }

    public WorldContext withGrids(List<Grid> newGrids) {
        return new WorldContext(config, registry, List.copyOf(newGrids), heightmap, planet, terrain);
    }

    public WorldContext withHeightmap(double[] newHeightmap) {
        return new WorldContext(config, registry, grids, newHeightmap.clone(), planet, terrain);
    }

    public WorldContext withPlanet(Planet newPlanet) {
        return new WorldContext(config, registry, grids, heightmap, Objects.requireNonNull(newPlanet, "planet"),
                terrain);
    }

    public WorldContext withTerrain(TerrainType[] newTerrain) {
        return new WorldContext(config, registry, grids, heightmap, planet, newTerrain.clone());
    }

    public GenerationConfig config() {
        return config;
    }

    public TerrainAlgorithmRegistry registry() {
        return registry;
    }

    public boolean hasGrids() {
        return grids != null;
    }

    public List<Grid> grids() {
        return require(grids, "grids");
    }

    public Grid finestGrid() {
        List<Grid> g = grids();
        return g.get(g.size() - 1);
    }

    public double[] heightmap() {
        return require(heightmap, "heightmap").clone();
    }

    public boolean hasPlanet() {
        return planet != null;
    }

    public Planet planet() {
        return require(planet, "planet");
    }

    public boolean hasTerrain() {
        return terrain != null;
    }

    public TerrainType[] terrainTypes() {
        return require(terrain, "terrain").clone();
    }

    private static <T> T require(T value, String what) {
        if (value == null) {
            throw new IllegalStateException("World context has no " + what + " yet");
        }
        return value;
    }
}
