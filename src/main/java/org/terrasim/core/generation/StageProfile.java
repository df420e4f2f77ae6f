package org.terrasim.core.generation;

import org.terrasim.core.model.config.ConfigurationException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public class StageProfile {
    private final String name;
    private final Set<StageId> enabled;

    private StageProfile(String name, Set<StageId> enabled) {
        this.name = name;
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public String name() {
        return name;
    }

    public static StageProfile full() {
        return new StageProfile("full", EnumSet.allOf(StageId.class));
    }

    // только рельеф: без рек и климата
    public static StageProfile terrainOnly() {
        return new StageProfile("terrainOnly", EnumSet.of(
                StageId.GRID,
                StageId.TERRAIN,
                StageId.PLANET,
                StageId.SEA_LEVEL
        ));
    }

    public static StageProfile upToRivers() {
        return new StageProfile("upToRivers", EnumSet.of(
                StageId.GRID,
                StageId.TERRAIN,
                StageId.PLANET,
                StageId.SEA_LEVEL,
                StageId.RIVERS
        ));
    }

    /** Имя из конфигурации: full / terrainOnly / upToRivers (регистр не важен). */
    public static StageProfile byName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "full" -> full();
            case "terrainonly" -> terrainOnly();
            case "uptorivers" -> upToRivers();
            default -> throw new ConfigurationException("Unknown stage profile '" + name
                    + "' (expected full, terrainOnly, upToRivers)");
        };
    }

    @Override
    public String toString() {
        return name + enabled;
    }
}
