package org.terrasim.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Сошедшийся (или последний полный) годовой цикл: сезоны 0..seasonsPerCycle-1.
 */
public final class ClimateState {

    private final List<SeasonClimate> seasons;
    private final int cycles;
    private final double lastDelta;

    public ClimateState(List<SeasonClimate> seasons, int cycles, double lastDelta) {
        if (seasons == null || seasons.isEmpty()) {
            throw new IllegalArgumentException("Climate state needs at least one season");
        }
        for (int s = 0; s < seasons.size(); s++) {
            if (seasons.get(s).season() != s) {
                throw new IllegalArgumentException("Season " + s + " stored at wrong position: "
                        + seasons.get(s).season());
            }
        }
        this.seasons = List.copyOf(seasons);
        this.cycles = cycles;
        this.lastDelta = lastDelta;
    }

    public int seasonCount() {
        return seasons.size();
    }

    public SeasonClimate season(int season) {
        return seasons.get(Objects.checkIndex(season, seasons.size()));
    }

    public List<SeasonClimate> seasons() {
        return seasons;
    }

    /** Сколько полных циклов понадобилось. */
    public int cycles() {
        return cycles;
    }

    /** Max разница последнего цикла с предыдущим. */
    public double lastDelta() {
        return lastDelta;
    }
}
