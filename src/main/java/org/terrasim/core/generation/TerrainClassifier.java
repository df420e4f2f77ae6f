package org.terrasim.core.generation;

import org.terrasim.core.model.Planet;
import org.terrasim.core.model.SeasonClimate;
import org.terrasim.core.model.TerrainType;
import org.terrasim.core.model.ClimateState;

/**
 * Тип местности по высоте и годовому ряду климата.
 * Пороги высоты - в метрах над уровнем моря, температура - K, осадки - мм/сутки.
 */
public class TerrainClassifier {

    static final double DEEP_OCEAN_BELOW = -3500.0;
    static final double MID_OCEAN_BELOW = -1500.0;
    static final double HILL_ABOVE = 500.0;
    static final double MOUNTAIN_ABOVE = 825.0;

    static final double WETLAND_PRECIPITATION = 1.728;

    static final double HEAVY_FOREST_LAI = 8.0;
    static final double FOREST_LAI = 6.25;
    static final double SAVANNA_LAI = 5.9;
    static final double GRASS_LAI = 4.0;

    static final double JUNGLE_LAI_SPREAD = 2.0;
    static final double BOREAL_LAI_SPREAD = 6.5;
    static final double DECIDUOUS_LAI_SPREAD = 8.0;

    static final double JUNGLE_MIN_TEMPERATURE = 303.15;
    static final double SAND_DESERT_MIN_TEMPERATURE = 288.15;
    static final double SNOW_DESERT_MAX_TEMPERATURE = 283.15;

    public TerrainType[] classifyAll(Planet planet) {
        TerrainType[] out = new TerrainType[planet.tileCount()];
        TileLoops.forEachIndex(out.length, t -> out[t] = classify(planet, t));
        return out;
    }

    public TerrainType classify(Planet planet, int tile) {
        double elevation = planet.elevation(tile);
        if (elevation < DEEP_OCEAN_BELOW) return TerrainType.DEEP_OCEAN;
        if (elevation < MID_OCEAN_BELOW) return TerrainType.MID_OCEAN;
        if (elevation < 0.0) return TerrainType.SURFACE_OCEAN;

        ClimateState climate = planet.climate();
        int seasons = climate.seasonCount();

        double minLai = Double.POSITIVE_INFINITY;
        double maxLai = Double.NEGATIVE_INFINITY;
        double minT = Double.POSITIVE_INFINITY;
        double maxT = Double.NEGATIVE_INFINITY;
        boolean alwaysWet = true;
        int snowySeasons = 0;
        for (int s = 0; s < seasons; s++) {
            SeasonClimate c = climate.season(s);
            double lai = c.leafAreaIndex(tile);
            double temp = c.temperature(tile);
            minLai = Math.min(minLai, lai);
            maxLai = Math.max(maxLai, lai);
            minT = Math.min(minT, temp);
            maxT = Math.max(maxT, temp);
            boolean snowy = c.snow(tile) > 0.0;
            if (snowy) snowySeasons++;
            if (!(c.precipitation(tile) > WETLAND_PRECIPITATION || snowy)) alwaysWet = false;
        }

        // болота: низина, весь год мокро, но не круглогодичный снег
        if (elevation < HILL_ABOVE && alwaysWet && snowySeasons < seasons) {
            return maxLai > SAVANNA_LAI ? TerrainType.SWAMP : TerrainType.MARSH;
        }

        if (maxLai > FOREST_LAI) {
            return forest(elevation, maxLai, maxLai - minLai, minT);
        }

        if (elevation > MOUNTAIN_ABOVE) {
            boolean frozen = snowySeasons == seasons || maxT < ClimateSimulator.FREEZING_K;
            return frozen ? TerrainType.SNOW_MOUNTAIN : TerrainType.MOUNTAIN;
        }

        if (maxLai > SAVANNA_LAI) {
            return elevation > HILL_ABOVE ? TerrainType.HILL_SAVANNA : TerrainType.SAVANNA;
        }
        if (maxLai > GRASS_LAI) return TerrainType.GRASS;

        if (minT > SAND_DESERT_MIN_TEMPERATURE) return TerrainType.SAND_DESERT;
        if (maxT < SNOW_DESERT_MAX_TEMPERATURE) return TerrainType.SNOW_DESERT;
        return TerrainType.DESERT;
    }

    private TerrainType forest(double elevation, double maxLai, double spread, double minT) {
        TerrainType.Forest kind;
        if (spread < JUNGLE_LAI_SPREAD && minT > JUNGLE_MIN_TEMPERATURE) {
            kind = TerrainType.Forest.JUNGLE;
        } else if (spread < BOREAL_LAI_SPREAD) {
            kind = TerrainType.Forest.BOREAL;
        } else if (spread > DECIDUOUS_LAI_SPREAD) {
            kind = TerrainType.Forest.DECIDUOUS;
        } else {
            kind = TerrainType.Forest.MIXED;
        }

        boolean mountain = elevation > MOUNTAIN_ABOVE;
        boolean hill = !mountain && elevation > HILL_ABOVE;
        boolean heavy = maxLai > HEAVY_FOREST_LAI;

        switch (kind) {
            case JUNGLE:
                return mountain ? TerrainType.MOUNTAIN_JUNGLE_FOREST
                        : hill ? TerrainType.HILL_JUNGLE_FOREST
                        : heavy ? TerrainType.HEAVY_JUNGLE_FOREST : TerrainType.JUNGLE_FOREST;
            case BOREAL:
                return mountain ? TerrainType.MOUNTAIN_BOREAL_FOREST
                        : hill ? TerrainType.HILL_BOREAL_FOREST
                        : heavy ? TerrainType.HEAVY_BOREAL_FOREST : TerrainType.BOREAL_FOREST;
            case DECIDUOUS:
                return mountain ? TerrainType.MOUNTAIN_DECIDUOUS_FOREST
                        : hill ? TerrainType.HILL_DECIDUOUS_FOREST
                        : heavy ? TerrainType.HEAVY_DECIDUOUS_FOREST : TerrainType.DECIDUOUS_FOREST;
            default:
                return mountain ? TerrainType.MOUNTAIN_MIXED_FOREST
                        : hill ? TerrainType.HILL_MIXED_FOREST
                        : heavy ? TerrainType.HEAVY_MIXED_FOREST : TerrainType.MIXED_FOREST;
        }
    }
}
