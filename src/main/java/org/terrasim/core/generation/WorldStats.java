package org.terrasim.core.generation;

import org.terrasim.core.model.ClimateState;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.SeasonClimate;
import org.terrasim.core.model.TerrainType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Сводка по планете. Доли считаются по площади (0..1).
 */
public class WorldStats {

    public int tileCount;
    public double totalAreaKm2;

    // elevation
    public double elevationMin = Double.POSITIVE_INFINITY;
    public double elevationMax = Double.NEGATIVE_INFINITY;
    public double elevationAvg;

    // суша / океан
    public double landShare;
    public double oceanShare;

    // рельеф суши (доли от суши)
    public double flatShare;
    public double hillShare;
    public double mountainShare;

    // rivers
    public boolean hasRivers;
    public int riverSinks;
    public double maxDischarge;

    // климат: среднегодовые значения по тайлам
    public boolean hasClimate;
    public int climateCycles;
    public double tempMin = Double.POSITIVE_INFINITY;
    public double tempMax = Double.NEGATIVE_INFINITY;
    public double tempAvg;
    public double precipMin = Double.POSITIVE_INFINITY;
    public double precipMax = Double.NEGATIVE_INFINITY;
    public double precipAvg;

    // покров (доли от суши)
    public boolean hasTerrain;
    public final Map<TerrainType.Cover, Double> coverShare = new EnumMap<>(TerrainType.Cover.class);
    // типы леса (доли от леса)
    public final Map<TerrainType.Forest, Double> forestShare = new EnumMap<>(TerrainType.Forest.class);
    // SAND_DESERT / SNOW_DESERT / DESERT (доли от всей пустыни)
    public final Map<TerrainType, Double> desertShare = new EnumMap<>(TerrainType.class);
    // MARSH / SWAMP (доли от болот)
    public final Map<TerrainType, Double> wetlandShare = new EnumMap<>(TerrainType.class);
    public final Map<TerrainType, Integer> terrainCounts = new EnumMap<>(TerrainType.class);

    public static WorldStats compute(Planet planet, TerrainType[] terrain) {
        WorldStats s = new WorldStats();
        int n = planet.tileCount();
        s.tileCount = n;

        double landArea = 0.0;
        double elevSum = 0.0;
        double[] reliefArea = new double[3];
        for (int t = 0; t < n; t++) {
            double a = planet.area(t);
            double e = planet.elevation(t);
            s.totalAreaKm2 += a;
            s.elevationMin = Math.min(s.elevationMin, e);
            s.elevationMax = Math.max(s.elevationMax, e);
            elevSum += e;
            if (planet.isLand(t)) {
                landArea += a;
                if (e > TerrainClassifier.MOUNTAIN_ABOVE) reliefArea[2] += a;
                else if (e > TerrainClassifier.HILL_ABOVE) reliefArea[1] += a;
                else reliefArea[0] += a;
            }
        }
        s.elevationAvg = elevSum / Math.max(1, n);
        s.landShare = share(landArea, s.totalAreaKm2);
        s.oceanShare = 1.0 - s.landShare;
        s.flatShare = share(reliefArea[0], landArea);
        s.hillShare = share(reliefArea[1], landArea);
        s.mountainShare = share(reliefArea[2], landArea);

        if (planet.hasRivers()) {
            s.hasRivers = true;
            for (int t = 0; t < n; t++) {
                if (planet.isLand(t) && planet.flowTarget(t) == Planet.NO_TARGET) s.riverSinks++;
                s.maxDischarge = Math.max(s.maxDischarge, planet.discharge(t));
            }
        }

        if (planet.hasClimate()) {
            s.hasClimate = true;
            ClimateState climate = planet.climate();
            s.climateCycles = climate.cycles();
            int seasons = climate.seasonCount();
            double tempSum = 0.0;
            double precipSum = 0.0;
            for (int t = 0; t < n; t++) {
                double temp = 0.0;
                double precip = 0.0;
                for (SeasonClimate c : climate.seasons()) {
                    temp += c.temperature(t);
                    precip += c.precipitation(t);
                }
                temp /= seasons;
                precip /= seasons;
                s.tempMin = Math.min(s.tempMin, temp);
                s.tempMax = Math.max(s.tempMax, temp);
                s.precipMin = Math.min(s.precipMin, precip);
                s.precipMax = Math.max(s.precipMax, precip);
                tempSum += temp;
                precipSum += precip;
            }
            s.tempAvg = tempSum / Math.max(1, n);
            s.precipAvg = precipSum / Math.max(1, n);
        }

        if (terrain != null) {
            s.hasTerrain = true;
            Map<TerrainType.Cover, Double> coverArea = new EnumMap<>(TerrainType.Cover.class);
            Map<TerrainType.Forest, Double> forestArea = new EnumMap<>(TerrainType.Forest.class);
            Map<TerrainType, Double> desertArea = new EnumMap<>(TerrainType.class);
            Map<TerrainType, Double> wetlandArea = new EnumMap<>(TerrainType.class);
            double forestTotal = 0.0;
            double desertTotal = 0.0;
            double wetlandTotal = 0.0;
            for (int t = 0; t < n; t++) {
                TerrainType type = terrain[t];
                s.terrainCounts.merge(type, 1, Integer::sum);
                if (type.isOcean()) continue;
                double a = planet.area(t);
                coverArea.merge(type.cover, a, Double::sum);
                if (type.cover == TerrainType.Cover.FOREST) {
                    forestArea.merge(type.forest, a, Double::sum);
                    forestTotal += a;
                } else if (type.cover == TerrainType.Cover.DESERT) {
                    desertArea.merge(type, a, Double::sum);
                    desertTotal += a;
                } else if (type.cover == TerrainType.Cover.WETLAND) {
                    wetlandArea.merge(type, a, Double::sum);
                    wetlandTotal += a;
                }
            }
            for (Map.Entry<TerrainType.Cover, Double> e : coverArea.entrySet()) {
                s.coverShare.put(e.getKey(), share(e.getValue(), landArea));
            }
            for (Map.Entry<TerrainType.Forest, Double> e : forestArea.entrySet()) {
                s.forestShare.put(e.getKey(), share(e.getValue(), forestTotal));
            }
            for (Map.Entry<TerrainType, Double> e : desertArea.entrySet()) {
                s.desertShare.put(e.getKey(), share(e.getValue(), desertTotal));
            }
            for (Map.Entry<TerrainType, Double> e : wetlandArea.entrySet()) {
                s.wetlandShare.put(e.getKey(), share(e.getValue(), wetlandTotal));
            }
        }

        if (n == 0) {
            s.elevationMin = s.elevationMax = 0.0;
        }
        if (!s.hasClimate) {
            s.tempMin = s.tempMax = 0.0;
            s.precipMin = s.precipMax = 0.0;
        }
        return s;
    }

    private static double share(double part, double whole) {
        return whole > 0.0 ? part / whole : 0.0;
    }
}
