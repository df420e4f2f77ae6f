package org.terrasim.core.terrain;

import org.terrasim.core.model.config.TerrainParameters;
import org.terrasim.core.topology.Grid;

import java.util.List;

/**
 * Вход вычисления выражения рельефа: вся последовательность сеток G0..GN
 * и параметры именованного алгоритма.
 */
public final class TerrainContext {

    private final List<Grid> grids;
    private final TerrainParameters parameters;

    public TerrainContext(List<Grid> grids, TerrainParameters parameters) {
        if (grids == null || grids.isEmpty()) {
            throw new IllegalArgumentException("Grid sequence is empty");
        }
        for (int i = 0; i < grids.size(); i++) {
            if (grids.get(i).level() != i) {
                throw new IllegalArgumentException("Grid sequence must be G0..GN, found level "
                        + grids.get(i).level() + " at position " + i);
            }
        }
        this.grids = List.copyOf(grids);
        this.parameters = parameters;
    }

    public List<Grid> grids() {
        return grids;
    }

    public Grid finest() {
        return grids.get(grids.size() - 1);
    }

    public int tileCount() {
        return finest().tileCount();
    }

    public TerrainParameters parameters() {
        return parameters;
    }
}
