package org.terrasim.core.terrain;

import java.util.Map;

/**
 * Внешний источник алгоритмов: категория -> (имя -> выражение).
 * Вызывается один раз при старте, до генерации.
 */
@FunctionalInterface
public interface AlgorithmSource {

    Map<String, TerrainExpression> load(String category);
}
