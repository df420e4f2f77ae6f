package org.terrasim.core.generation;

public enum StageId {
    GRID,
    TERRAIN,
    PLANET,
    SEA_LEVEL,
    RIVERS,
    CLIMATE,
    CLASSIFY
}
