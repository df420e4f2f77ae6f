package org.terrasim.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.TerrainType;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

public class WorldStatsReport {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorldStatsReport.class);

    private WorldStatsReport() {}

    public static void log(WorldStats s) {
        if (!LOGGER.isInfoEnabled()) return;
        LOGGER.info("========= WORLD STATS =========");
        LOGGER.info("Tiles: {}  area: {} km^2", s.tileCount, fmt(s.totalAreaKm2));
        LOGGER.info("Elevation: min={} max={} avg={}", fmt(s.elevationMin), fmt(s.elevationMax), fmt(s.elevationAvg));
        LOGGER.info("Ocean: {}  Land: {}", pct(s.oceanShare), pct(s.landShare));
        LOGGER.info("Land relief: flat={} hill={} mountain={}", pct(s.flatShare), pct(s.hillShare),
                pct(s.mountainShare));

        if (s.hasRivers) {
            LOGGER.info("Rivers: sinks={} maxDischarge={}", s.riverSinks, fmt(s.maxDischarge));
        }
        if (s.hasClimate) {
            LOGGER.info("Climate cycles: {}", s.climateCycles);
            LOGGER.info("Temperature (annual mean, K): min={} max={} avg={}",
                    fmt(s.tempMin), fmt(s.tempMax), fmt(s.tempAvg));
            LOGGER.info("Precip (annual mean, mm/day): min={} max={} avg={}",
                    fmt(s.precipMin), fmt(s.precipMax), fmt(s.precipAvg));
        }
        if (s.hasTerrain) {
            for (Map.Entry<TerrainType.Cover, Double> e : s.coverShare.entrySet()) {
                LOGGER.info("  {} : {} of land", pad(e.getKey().name()), pct(e.getValue()));
            }
            for (Map.Entry<TerrainType.Forest, Double> e : s.forestShare.entrySet()) {
                LOGGER.info("    forest {} : {}", pad(e.getKey().name()), pct(e.getValue()));
            }
            for (Map.Entry<TerrainType, Double> e : s.desertShare.entrySet()) {
                LOGGER.info("    desert {} : {}", pad(e.getKey().name()), pct(e.getValue()));
            }
            for (Map.Entry<TerrainType, Double> e : s.wetlandShare.entrySet()) {
                LOGGER.info("    wetland {} : {}", pad(e.getKey().name()), pct(e.getValue()));
            }
            LOGGER.info("Terrain types (top):");
            s.terrainCounts.entrySet().stream()
                    .sorted(Map.Entry.comparingByValue(Comparator.reverseOrder()))
                    .limit(12)
                    .forEach(e -> LOGGER.info("  {} : {}", pad(e.getKey().name()), e.getValue()));
        }
        LOGGER.info("================================");
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.3f", v);
    }

    private static String pct(double share) {
        return String.format(Locale.US, "%.1f%%", share * 100.0);
    }

    private static String pad(String name) {
        return String.format("%-26s", name);
    }
}
