package org.terrasim.core.model;

import org.terrasim.core.model.config.ClimateParameters;
import org.terrasim.core.topology.Grid;
import org.terrasim.core.topology.Vec3;

import java.util.Objects;

/**
 * Неизменяемая планета: сетка + радиус + ось + поля по тайлам.
 *
 * Высота в метрах относительно уровня моря (0 = уровень моря),
 * суша <=> elevation >= 0. Реки и климат появляются после своих стадий
 * (до этого hasRivers()/hasClimate() = false).
 */
public final class Planet {

    /** riverTo для стока / океана. */
    public static final int NO_TARGET = -1;

    private final Grid grid;
    private final double radiusKm;
    private final Vec3 rotationAxis;
    private final double seaLevel;
    private final double[] elevation;
    /** км^2 */
    private final double[] area;

    private final int[] flowTarget;
    private final double[] discharge;

    private final ClimateParameters climateParameters;
    private final ClimateState climate;

    public Planet(Grid grid, double radiusKm, Vec3 rotationAxis, double seaLevel, double[] elevation, double[] area) {
        this(grid, radiusKm, rotationAxis, seaLevel, checkField(grid, elevation, "elevation").clone(),
                checkField(grid, area, "area").clone(), null, null, null, null);
    }

    private Planet(Grid grid,
                   double radiusKm,
                   Vec3 rotationAxis,
                   double seaLevel,
                   double[] elevation,
                   double[] area,
                   int[] flowTarget,
                   double[] discharge,
                   ClimateParameters climateParameters,
                   ClimateState climate) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.radiusKm = radiusKm;
        this.rotationAxis = Objects.requireNonNull(rotationAxis, "rotationAxis");
        this.seaLevel = seaLevel;
        this.elevation = elevation;
        this.area = area;
        this.flowTarget = flowTarget;
        this.discharge = discharge;
        this.climateParameters = climateParameters;
        this.climate = climate;
    }

    /** Новая высота и накопленный сдвиг уровня моря; реки и климат сбрасываются. */
    public Planet withElevation(double newSeaLevel, double[] newElevation) {
        return new Planet(grid, radiusKm, rotationAxis, newSeaLevel,
                checkField(grid, newElevation, "elevation").clone(), area, null, null, null, null);
    }

    public Planet withRivers(int[] newFlowTarget, double[] newDischarge) {
        if (newFlowTarget.length != grid.tileCount()) {
            throw new IllegalArgumentException("flowTarget size " + newFlowTarget.length
                    + " != tileCount " + grid.tileCount());
        }
        return new Planet(grid, radiusKm, rotationAxis, seaLevel, elevation, area,
                newFlowTarget.clone(), checkField(grid, newDischarge, "discharge").clone(),
                climateParameters, climate);
    }

    public Planet withClimate(ClimateParameters parameters, ClimateState state) {
        if (state.season(0).tileCount() != grid.tileCount()) {
            throw new IllegalArgumentException("Climate tile count " + state.season(0).tileCount()
                    + " != tileCount " + grid.tileCount());
        }
        return new Planet(grid, radiusKm, rotationAxis, seaLevel, elevation, area, flowTarget, discharge,
                Objects.requireNonNull(parameters, "parameters"), state);
    }

    // --- Геометрия ---

    public Grid grid() {
        return grid;
    }

    public int tileCount() {
        return grid.tileCount();
    }

    public double radiusKm() {
        return radiusKm;
    }

    public Vec3 rotationAxis() {
        return rotationAxis;
    }

    /** Широта (радианы) относительно оси вращения. */
    public double latitude(int tile) {
        double s = grid.tileCenter(tile).dot(rotationAxis);
        return Math.asin(Math.max(-1.0, Math.min(1.0, s)));
    }

    public double area(int tile) {
        return area[grid.checkTile(tile)];
    }

    /** Координата угла на сфере радиуса планеты, км. */
    public Vec3 cornerPosition(int corner) {
        return grid.cornerPosition(corner).scale(radiusKm);
    }

    // --- Рельеф ---

    public double seaLevel() {
        return seaLevel;
    }

    public double elevation(int tile) {
        return elevation[grid.checkTile(tile)];
    }

    public double[] elevationField() {
        return elevation.clone();
    }

    public boolean isLand(int tile) {
        return elevation(tile) >= 0.0;
    }

    public boolean isOcean(int tile) {
        return !isLand(tile);
    }

    // --- Гидрология ---

    public boolean hasRivers() {
        return flowTarget != null;
    }

    /** Тайл ниже по течению или NO_TARGET. */
    public int flowTarget(int tile) {
        requireRivers();
        return flowTarget[grid.checkTile(tile)];
    }

    public double discharge(int tile) {
        requireRivers();
        return discharge[grid.checkTile(tile)];
    }

    // --- Климат ---

    public boolean hasClimate() {
        return climate != null;
    }

    public ClimateParameters climateParameters() {
        requireClimate();
        return climateParameters;
    }

    public ClimateState climate() {
        requireClimate();
        return climate;
    }

    public SeasonClimate season(int season) {
        return climate().season(season);
    }

    private void requireRivers() {
        if (flowTarget == null) {
            throw new IllegalStateException("Rivers are not generated for this planet");
        }
    }

    private void requireClimate() {
        if (climate == null) {
            throw new IllegalStateException("Climate is not simulated for this planet");
        }
    }

    private static double[] checkField(Grid grid, double[] field, String name) {
        Objects.requireNonNull(field, name);
        if (field.length != grid.tileCount()) {
            throw new IllegalArgumentException(name + " size " + field.length + " != tileCount " + grid.tileCount());
        }
        return field;
    }

    @Override
    public String toString() {
        return "Planet{tiles=" + tileCount() + ", radiusKm=" + radiusKm + ", seaLevel=" + seaLevel
                + ", rivers=" + hasRivers() + ", climate=" + hasClimate() + "}";
    }
}
