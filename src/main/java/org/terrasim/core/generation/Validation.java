package org.terrasim.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.ClimateState;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.SeasonClimate;
import org.terrasim.core.topology.Grid;

import java.util.List;

public final class Validation {

    private static final Logger LOGGER = LoggerFactory.getLogger(Validation.class);

    /** Относительный допуск суммы площадей против 4*pi*R^2. */
    static final double AREA_TOLERANCE = 1e-6;

    private Validation() {}

    public static void afterGrid(WorldContext ctx) {
        List<Grid> grids = ctx.grids();
        for (Grid g : grids) {
            int want = Grid.expectedTileCount(g.level());
            if (g.tileCount() != want) {
                throw new IllegalStateException("Wrong tile count at level " + g.level()
                        + " have=" + g.tileCount() + " want=" + want);
            }
        }

        Grid grid = ctx.finestGrid();
        for (int t = 0; t < grid.tileCount(); t++) {
            int want = t < 12 ? 5 : 6;
            int have = grid.tileEdgeCount(t);
            if (have != want) {
                throw new IllegalStateException("Wrong neighbor count for tile id=" + t
                        + " have=" + have + " want=" + want);
            }
        }
        if (grid.cornerCount() != 2 * grid.tileCount() - 4) {
            throw new IllegalStateException("Wrong corner count: " + grid.cornerCount());
        }
    }

    public static void afterTerrain(WorldContext ctx) {
        double[] h = ctx.heightmap();
        double first = h[0];
        boolean allSame = true;
        for (int t = 0; t < h.length; t++) {
            if (Double.isNaN(h[t]) || Double.isInfinite(h[t])) {
                throw new IllegalStateException("Non-finite elevation after Terrain for tile id=" + t);
            }
            if (h[t] != first) allSame = false;
        }
        if (allSame) {
            // не ошибка: "flat" так и задуман
            LOGGER.warn("Elevation seems constant after Terrain: {}", first);
        }
    }

    public static void afterSeaLevel(WorldContext ctx) {
        Planet planet = ctx.planet();
        double total = 0.0;
        int land = 0;
        for (int t = 0; t < planet.tileCount(); t++) {
            double a = planet.area(t);
            if (!(a > 0.0)) {
                throw new IllegalStateException("Non-positive area for tile id=" + t + " area=" + a);
            }
            total += a;
            if (planet.isLand(t)) land++;
        }
        double sphere = 4.0 * Math.PI * planet.radiusKm() * planet.radiusKm();
        if (Math.abs(total - sphere) > AREA_TOLERANCE * sphere) {
            throw new IllegalStateException("Tile areas sum to " + total + " km^2, sphere is " + sphere);
        }
        if (land == 0) {
            LOGGER.warn("No land after sea level shift");
        } else if (land == planet.tileCount()) {
            LOGGER.warn("No ocean after sea level shift");
        }
    }

    public static void afterRivers(WorldContext ctx) {
        Planet planet = ctx.planet();
        for (int t = 0; t < planet.tileCount(); t++) {
            int target = planet.flowTarget(t);
            if (planet.isOcean(t)) {
                if (target != Planet.NO_TARGET || planet.discharge(t) != 0.0) {
                    throw new IllegalStateException("Ocean tile id=" + t + " has river flow");
                }
            } else if (planet.discharge(t) < 1.0) {
                throw new IllegalStateException("Land tile id=" + t + " discharge < 1: " + planet.discharge(t));
            }
        }
    }

    public static void afterClimate(WorldContext ctx) {
        Planet planet = ctx.planet();
        ClimateState climate = planet.climate();
        for (SeasonClimate s : climate.seasons()) {
            for (int t = 0; t < planet.tileCount(); t++) {
                checkNonNegative(s.insolation(t), "insolation", s.season(), t);
                checkNonNegative(s.temperature(t), "temperature", s.season(), t);
                checkNonNegative(s.humidity(t), "humidity", s.season(), t);
                checkNonNegative(s.precipitation(t), "precipitation", s.season(), t);
                checkNonNegative(s.snow(t), "snow", s.season(), t);
                double lai = s.leafAreaIndex(t);
                if (!(lai >= 0.0 && lai <= 10.0)) {
                    throw new IllegalStateException("LAI out of range in season " + s.season()
                            + " tile id=" + t + " lai=" + lai);
                }
            }
        }
    }

    private static void checkNonNegative(double value, String field, int season, int tile) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalStateException("Invalid " + field + " in season " + season
                    + " tile id=" + tile + " value=" + value);
        }
    }
}
