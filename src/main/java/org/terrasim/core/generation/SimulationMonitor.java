package org.terrasim.core.generation;

/**
 * Наблюдатель за климатической итерацией: прогресс по циклам и отмена.
 */
public interface SimulationMonitor {

    SimulationMonitor NONE = new SimulationMonitor() {
        @Override
        public void onCycle(int cycle, double maxDelta) {
        }

        @Override
        public boolean isCancelled() {
            return false;
        }
    };

    /** Вызывается после каждого полного цикла; для первого цикла maxDelta = +inf. */
    void onCycle(int cycle, double maxDelta);

    /** Опрашивается между сезонами. */
    boolean isCancelled();
}
