package org.terrasim.core.generation;

/**
 * Стадия конвейера: получает контекст и возвращает новый, исходный не меняется.
 */
public interface GenerationStage {
    StageId id();
    String name();
    WorldContext apply(WorldContext ctx);
}
