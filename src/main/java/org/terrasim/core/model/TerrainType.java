package org.terrasim.core.model;

/**
 * Итоговый тип местности тайла (по высоте и сезонному климату).
 */
public enum TerrainType {

    DEEP_OCEAN(Relief.OCEAN, Cover.WATER, Forest.NONE),
    MID_OCEAN(Relief.OCEAN, Cover.WATER, Forest.NONE),
    SURFACE_OCEAN(Relief.OCEAN, Cover.WATER, Forest.NONE),

    // ---- водно-болотные ----
    SWAMP(Relief.FLAT, Cover.WETLAND, Forest.NONE),
    MARSH(Relief.FLAT, Cover.WETLAND, Forest.NONE),

    // ---- леса ----
    JUNGLE_FOREST(Relief.FLAT, Cover.FOREST, Forest.JUNGLE),
    HEAVY_JUNGLE_FOREST(Relief.FLAT, Cover.FOREST, Forest.JUNGLE),
    HILL_JUNGLE_FOREST(Relief.HILL, Cover.FOREST, Forest.JUNGLE),
    MOUNTAIN_JUNGLE_FOREST(Relief.MOUNTAIN, Cover.FOREST, Forest.JUNGLE),

    DECIDUOUS_FOREST(Relief.FLAT, Cover.FOREST, Forest.DECIDUOUS),
    HEAVY_DECIDUOUS_FOREST(Relief.FLAT, Cover.FOREST, Forest.DECIDUOUS),
    HILL_DECIDUOUS_FOREST(Relief.HILL, Cover.FOREST, Forest.DECIDUOUS),
    MOUNTAIN_DECIDUOUS_FOREST(Relief.MOUNTAIN, Cover.FOREST, Forest.DECIDUOUS),

    MIXED_FOREST(Relief.FLAT, Cover.FOREST, Forest.MIXED),
    HEAVY_MIXED_FOREST(Relief.FLAT, Cover.FOREST, Forest.MIXED),
    HILL_MIXED_FOREST(Relief.HILL, Cover.FOREST, Forest.MIXED),
    MOUNTAIN_MIXED_FOREST(Relief.MOUNTAIN, Cover.FOREST, Forest.MIXED),

    BOREAL_FOREST(Relief.FLAT, Cover.FOREST, Forest.BOREAL),
    HEAVY_BOREAL_FOREST(Relief.FLAT, Cover.FOREST, Forest.BOREAL),
    HILL_BOREAL_FOREST(Relief.HILL, Cover.FOREST, Forest.BOREAL),
    MOUNTAIN_BOREAL_FOREST(Relief.MOUNTAIN, Cover.FOREST, Forest.BOREAL),

    // ---- горы без леса ----
    MOUNTAIN(Relief.MOUNTAIN, Cover.BARE, Forest.NONE),
    SNOW_MOUNTAIN(Relief.MOUNTAIN, Cover.BARE, Forest.NONE),

    SAVANNA(Relief.FLAT, Cover.SAVANNA, Forest.NONE),
    HILL_SAVANNA(Relief.HILL, Cover.SAVANNA, Forest.NONE),
    GRASS(Relief.FLAT, Cover.GRASS, Forest.NONE),

    SAND_DESERT(Relief.FLAT, Cover.DESERT, Forest.NONE),
    SNOW_DESERT(Relief.FLAT, Cover.DESERT, Forest.NONE),
    DESERT(Relief.FLAT, Cover.DESERT, Forest.NONE);

    public enum Relief { OCEAN, FLAT, HILL, MOUNTAIN }

    public enum Cover { WATER, WETLAND, FOREST, SAVANNA, GRASS, DESERT, BARE }

    public enum Forest { NONE, JUNGLE, DECIDUOUS, MIXED, BOREAL }

    public final Relief relief;
    public final Cover cover;
    public final Forest forest;

    TerrainType(Relief relief, Cover cover, Forest forest) {
        this.relief = relief;
        this.cover = cover;
        this.forest = forest;
    }

    public boolean isOcean() {
        return relief == Relief.OCEAN;
    }
}
