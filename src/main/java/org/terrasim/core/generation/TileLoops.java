package org.terrasim.core.generation;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Цикл по тайлам: параллельно или последовательно (-Dterrasim.parallel=false).
 * Действие обязано писать только в свою ячейку.
 */
final class TileLoops {

    static final String PARALLEL_PROPERTY = "terrasim.parallel";

    private TileLoops() {}

    static void forEachIndex(int n, IntConsumer action) {
        if (parallelEnabled()) {
            IntStream.range(0, n).parallel().forEach(action);
        } else {
            for (int i = 0; i < n; i++) action.accept(i);
        }
    }

    static boolean parallelEnabled() {
        return Boolean.parseBoolean(System.getProperty(PARALLEL_PROPERTY, "true"));
    }
}
