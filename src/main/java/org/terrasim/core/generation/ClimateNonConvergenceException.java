package org.terrasim.core.generation;

import org.terrasim.core.model.ClimateState;

/**
 * Климат не сошёлся за maxCycles циклов.
 */
public class ClimateNonConvergenceException extends RuntimeException {

    private final int cycles;
    private final double lastDelta;
    private final transient ClimateState bestEffort;

    public ClimateNonConvergenceException(int cycles, double lastDelta, ClimateState bestEffort) {
        super("Climate did not converge after " + cycles + " cycles (last delta=" + lastDelta + ")");
        this.cycles = cycles;
        this.lastDelta = lastDelta;
        this.bestEffort = bestEffort;
    }

    public int cycles() {
        return cycles;
    }

    public double lastDelta() {
        return lastDelta;
    }

    /** Последний полный цикл. */
    public ClimateState bestEffort() {
        return bestEffort;
    }
}
