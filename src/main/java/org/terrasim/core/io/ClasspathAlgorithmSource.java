package org.terrasim.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.terrasim.core.model.config.ConfigurationException;
import org.terrasim.core.terrain.AlgorithmSource;
import org.terrasim.core.terrain.TerrainExpression;
import org.terrasim.core.terrain.TerrainExpressionParser;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Каталог алгоритмов из ресурсов: /algorithms/&lt;category&gt;.json
 */
public class ClasspathAlgorithmSource implements AlgorithmSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String basePath;

    public ClasspathAlgorithmSource() {
        this("/algorithms/");
    }

    public ClasspathAlgorithmSource(String basePath) {
        this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
    }

    @Override
    public Map<String, TerrainExpression> load(String category) {
        String resource = basePath + category + ".json";
        try (InputStream in = ClasspathAlgorithmSource.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Algorithm catalogue not found: " + resource);
            }
            JsonNode root = MAPPER.readTree(in);
            return TerrainExpressionParser.parseCatalogue(root, category);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read algorithm catalogue: " + resource, e);
        }
    }
}
