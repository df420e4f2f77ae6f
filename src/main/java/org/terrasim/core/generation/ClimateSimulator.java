package org.terrasim.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.ClimateState;
import org.terrasim.core.model.Planet;
import org.terrasim.core.model.SeasonClimate;
import org.terrasim.core.model.config.ClimateParameters;
import org.terrasim.core.topology.Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Сезонный климат как неподвижная точка годового цикла.
 *
 * next(...) - один сезон по предыдущему; singularClimate(...) крутит полные
 * циклы с нулевого состояния, пока каждый сезон не перестанет отличаться от
 * того же сезона прошлого цикла больше чем на acceptableDelta.
 */
public class ClimateSimulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClimateSimulator.class);

    public static final double YEAR_DAYS = 365.25;
    public static final double FREEZING_K = 273.15;

    private static final double STEFAN_BOLTZMANN = 5.670374419e-8;
    private static final double EMISSIVITY = 0.75;
    /** Вт/м^2, перенос тепла атмосферой/океаном; ночная сторона не уходит в 0 K */
    private static final double HEAT_TRANSPORT = 60.0;
    private static final double ALBEDO_LAND = 0.30;
    private static final double ALBEDO_OCEAN = 0.20;
    private static final double OCEAN_INERTIA = 0.7;
    /** K/м */
    private static final double LAPSE_RATE = 0.0065;
    private static final double TEMPERATURE_MIXING = 0.25;

    // влага
    private static final double OCEAN_EVAPORATION = 0.9;
    private static final double LAND_RECYCLING = 0.25;
    private static final int HUMIDITY_DIFFUSION_PASSES = 3;
    private static final double HUMIDITY_DIFFUSION = 0.5;
    private static final double CONDENSATION_RATE = 0.4;
    private static final double OROGRAPHIC_UPLIFT_PER_KM = 1.5;

    // снег
    private static final double SNOW_RETENTION = 0.8;
    /** мм/K/сутки */
    private static final double MELT_RATE = 4.0;

    // растительность
    private static final double LAI_MAX = 10.0;
    private static final double LAI_HALF_LIFE_DAYS = 120.0;

    public ClimateState singularClimate(Planet planet, ClimateParameters params) {
        return singularClimate(planet, params, SimulationMonitor.NONE);
    }

    public ClimateState singularClimate(Planet planet, ClimateParameters params, SimulationMonitor monitor) {
        int n = planet.tileCount();
        int seasons = params.seasonsPerCycle;

        SeasonClimate previous = SeasonClimate.zero(seasons - 1, n);
        List<SeasonClimate> lastCycle = null;
        double delta = Double.POSITIVE_INFINITY;

        for (int cycle = 1; cycle <= params.maxCycles; cycle++) {
            List<SeasonClimate> current = new ArrayList<>(seasons);
            for (int s = 0; s < seasons; s++) {
                if (monitor.isCancelled()) {
                    throw new CancellationException("Climate simulation cancelled at cycle " + cycle
                            + ", season " + s);
                }
                previous = next(planet, params, previous, s);
                current.add(previous);
            }

            if (lastCycle != null) {
                delta = 0.0;
                for (int s = 0; s < seasons; s++) {
                    delta = Math.max(delta, current.get(s).maxDifference(lastCycle.get(s)));
                }
            }
            monitor.onCycle(cycle, delta);
            LOGGER.debug("Climate cycle {}: maxDelta={}", cycle, delta);

            if (lastCycle != null && delta < params.acceptableDelta) {
                LOGGER.info("Climate converged: cycles={} maxDelta={} seasons={}", cycle, delta, seasons);
                return new ClimateState(current, cycle, delta);
            }
            lastCycle = current;
        }

        LOGGER.warn("Climate did not converge: cycles={} lastDelta={}", params.maxCycles, delta);
        throw new ClimateNonConvergenceException(params.maxCycles, delta,
                new ClimateState(lastCycle, params.maxCycles, delta));
    }

    /**
     * climate-next: состояние сезона season по состоянию предыдущего сезона.
     */
    public SeasonClimate next(Planet planet, ClimateParameters params, SeasonClimate previous, int season) {
        int n = planet.tileCount();
        if (previous.tileCount() != n) {
            throw new IllegalArgumentException("Previous season has " + previous.tileCount()
                    + " tiles, planet has " + n);
        }
        if (season < 0 || season >= params.seasonsPerCycle) {
            throw new IllegalArgumentException("Season out of range: " + season);
        }

        Grid grid = planet.grid();
        double tilt = Math.toRadians(params.axialTiltDeg);
        double phase = Insolation.phase(season, params.seasonsPerCycle);
        double seasonDays = YEAR_DAYS / params.seasonsPerCycle;

        // 1. инсоляция
        double[] insolation = new double[n];
        TileLoops.forEachIndex(n, t -> insolation[t] = Insolation.dailyMean(planet.latitude(t), tilt, phase));

        // 2. температура
        double[] radiative = new double[n];
        TileLoops.forEachIndex(n, t -> {
            double q = insolation[t];
            double albedo = ALBEDO_LAND;
            if (planet.isOcean(t)) {
                double annual = Insolation.annualMean(planet.latitude(t), tilt);
                q = OCEAN_INERTIA * annual + (1.0 - OCEAN_INERTIA) * q;
                albedo = ALBEDO_OCEAN;
            }
            double equilibrium = Math.pow((q * (1.0 - albedo) + HEAT_TRANSPORT) / (EMISSIVITY * STEFAN_BOLTZMANN), 0.25);
            radiative[t] = equilibrium - LAPSE_RATE * Math.max(0.0, planet.elevation(t));
        });
        double[] temperature = new double[n];
        TileLoops.forEachIndex(n, t ->
                temperature[t] = (1.0 - TEMPERATURE_MIXING) * radiative[t]
                        + TEMPERATURE_MIXING * neighbourMean(grid, radiative, t));

        // 3. влажность и осадки
        double decay = Math.pow(0.5, seasonDays / params.humidityHalfLifeDays);
        double[] humidity = new double[n];
        TileLoops.forEachIndex(n, t -> {
            double carry = decay * previous.humidity(t);
            double source;
            if (planet.isOcean(t)) {
                source = OCEAN_EVAPORATION * Math.max(0.0, capacity(temperature[t]) - carry);
            } else {
                double vegetation = 0.5 + 0.5 * Math.min(1.0, previous.leafAreaIndex(t) / LAI_MAX);
                double condensedBefore = previous.precipitation(t) * seasonDays / params.precipitationFactor;
                source = LAND_RECYCLING * vegetation * condensedBefore;
            }
            humidity[t] = carry + source;
        });
        double[] diffused = humidity;
        for (int pass = 0; pass < HUMIDITY_DIFFUSION_PASSES; pass++) {
            double[] from = diffused;
            double[] to = new double[n];
            TileLoops.forEachIndex(n, t ->
                    to[t] = (1.0 - HUMIDITY_DIFFUSION) * from[t] + HUMIDITY_DIFFUSION * neighbourMean(grid, from, t));
            diffused = to;
        }

        double[] wet = diffused;
        double[] precipitation = new double[n];
        double[] stored = new double[n];
        TileLoops.forEachIndex(n, t -> {
            double h = wet[t];
            double cap = capacity(temperature[t]);
            double uplift = 1.0 + OROGRAPHIC_UPLIFT_PER_KM * rise(planet, grid, t) / 1000.0;
            double condensed = Math.max(h * Math.min(1.0, CONDENSATION_RATE * (h / cap) * uplift), h - cap);
            precipitation[t] = params.precipitationFactor * condensed / seasonDays;
            stored[t] = h - condensed;
        });

        // 4. снег и растительность
        double[] snow = new double[n];
        double[] lai = new double[n];
        double laiKeep = Math.pow(0.5, seasonDays / LAI_HALF_LIFE_DAYS);
        TileLoops.forEachIndex(n, t -> {
            if (planet.isOcean(t)) {
                snow[t] = 0.0;
                lai[t] = 0.0;
                return;
            }
            double temp = temperature[t];
            if (temp <= FREEZING_K) {
                snow[t] = SNOW_RETENTION * previous.snow(t) + precipitation[t] * seasonDays;
            } else {
                snow[t] = Math.max(0.0, previous.snow(t) - MELT_RATE * (temp - FREEZING_K) * seasonDays);
            }
            double target = laiTarget(temp, precipitation[t], insolation[t]);
            lai[t] = target + (previous.leafAreaIndex(t) - target) * laiKeep;
        });

        return new SeasonClimate(season, insolation, temperature, stored, precipitation, snow, lai);
    }

    /** Насыщающая влажность, мм. */
    static double capacity(double temperatureK) {
        return 7.5 * Math.exp(0.07 * (temperatureK - FREEZING_K));
    }

    static double laiTarget(double temperatureK, double precipitation, double insolation) {
        double warmth = Math.max(0.0, Math.min(1.0, (temperatureK - FREEZING_K) / 20.0));
        double water = precipitation / (precipitation + 2.0);
        double light = insolation / (insolation + 100.0);
        return LAI_MAX * warmth * water * light;
    }

    /** Подъём над самым низким соседом, м (высоты ниже моря считаем 0). */
    private static double rise(Planet planet, Grid grid, int tile) {
        double own = Math.max(0.0, planet.elevation(tile));
        double lowest = own;
        int m = grid.tileEdgeCount(tile);
        for (int k = 0; k < m; k++) {
            lowest = Math.min(lowest, Math.max(0.0, planet.elevation(grid.tileNeighbor(tile, k))));
        }
        return own - lowest;
    }

    private static double neighbourMean(Grid grid, double[] field, int tile) {
        int m = grid.tileEdgeCount(tile);
        double sum = 0.0;
        for (int k = 0; k < m; k++) {
            sum += field[grid.tileNeighbor(tile, k)];
        }
        return sum / m;
    }
}
