package org.terrasim.core.terrain;

/**
 * Алгоритм рельефа как данные: по последовательности сеток выдаёт высоту (м)
 * для каждого тайла самой мелкой сетки.
 */
@FunctionalInterface
public interface TerrainExpression {

    double[] evaluate(TerrainContext ctx);
}
