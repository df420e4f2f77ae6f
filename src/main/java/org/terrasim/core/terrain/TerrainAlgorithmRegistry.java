package org.terrasim.core.terrain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terrasim.core.model.config.ConfigurationException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Неизменяемый реестр именованных алгоритмов рельефа одной категории.
 */
public final class TerrainAlgorithmRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(TerrainAlgorithmRegistry.class);

    private final String category;
    private final Map<String, TerrainExpression> algorithms;

    public TerrainAlgorithmRegistry(String category, Map<String, TerrainExpression> algorithms) {
        this.category = category;
        this.algorithms = Map.copyOf(algorithms);
    }

    public static TerrainAlgorithmRegistry load(AlgorithmSource source, String category) {
        Map<String, TerrainExpression> loaded = source.load(category);
        if (loaded == null) {
            throw new ConfigurationException("Algorithm source returned nothing for category: " + category);
        }
        TerrainAlgorithmRegistry registry = new TerrainAlgorithmRegistry(category, loaded);
        LOGGER.info("Loaded {} terrain algorithms for category '{}': {}",
                loaded.size(), category, registry.names());
        return registry;
    }

    public TerrainExpression get(String name) {
        TerrainExpression expr = algorithms.get(name);
        if (expr == null) {
            throw new ConfigurationException("Unknown terrain algorithm '" + name + "' in category '"
                    + category + "', known: " + names());
        }
        return expr;
    }

    public boolean contains(String name) {
        return algorithms.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(algorithms.keySet());
    }

    public String category() {
        return category;
    }
}
