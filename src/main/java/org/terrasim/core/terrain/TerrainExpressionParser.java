package org.terrasim.core.terrain;

import com.fasterxml.jackson.databind.JsonNode;
import org.terrasim.core.model.config.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON -> дерево выражений. Формат узла:
 * {"type": "constant|heightmap|lower|overlay|scale|sum", ...поля варианта}
 *
 * Ошибки формата сообщаются сразу, с путём до узла (например "continents.mountain.source").
 */
public final class TerrainExpressionParser {

    private TerrainExpressionParser() {}

    public static Map<String, TerrainExpression> parseCatalogue(JsonNode root, String category) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Algorithm catalogue '" + category + "' must be a JSON object");
        }
        Map<String, TerrainExpression> out = new LinkedHashMap<>();
        root.fields().forEachRemaining(e -> out.put(e.getKey(), parse(e.getValue(), e.getKey())));
        return out;
    }

    public static TerrainExpression parse(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Expression at '" + path + "' must be a JSON object");
        }
        String type = requireText(node, "type", path);
        switch (type) {
            case "constant":
                return TerrainExpressions.constant(requireNumber(node, "value", path));
            case "heightmap":
                return TerrainExpressions.heightmap(
                        node.has("octaves") ? requireOctaves(node, path) : null,
                        node.has("magnitude") ? requireMagnitude(node, path) : null,
                        node.has("persistence") ? requirePersistence(node, path) : null,
                        node.has("seedOffset") ? requireLong(node, "seedOffset", path) : 0L
                );
            case "lower":
                return TerrainExpressions.lower(
                        requireNumber(node, "threshold", path),
                        parse(require(node, "source", path), path + ".source")
                );
            case "overlay":
                return TerrainExpressions.overlay(
                        parse(require(node, "continent", path), path + ".continent"),
                        parse(require(node, "mountain", path), path + ".mountain")
                );
            case "scale":
                return TerrainExpressions.scale(
                        requireNumber(node, "factor", path),
                        parse(require(node, "source", path), path + ".source")
                );
            case "sum": {
                JsonNode terms = require(node, "terms", path);
                if (!terms.isArray() || terms.isEmpty()) {
                    throw new ConfigurationException("Field 'terms' at '" + path + "' must be a non-empty array");
                }
                List<TerrainExpression> parsed = new ArrayList<>();
                for (int i = 0; i < terms.size(); i++) {
                    parsed.add(parse(terms.get(i), path + ".terms[" + i + "]"));
                }
                return TerrainExpressions.sum(parsed);
            }
            default:
                throw new ConfigurationException("Unknown expression type '" + type + "' at '" + path + "'");
        }
    }

    private static JsonNode require(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigurationException("Missing field '" + field + "' at '" + path + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, String path) {
        JsonNode value = require(node, field, path);
        if (!value.isTextual()) {
            throw new ConfigurationException("Field '" + field + "' at '" + path + "' must be a string");
        }
        return value.asText();
    }

    // те же ограничения, что у TerrainParameters
    private static int requireOctaves(JsonNode node, String path) {
        double v = requireNumber(node, "octaves", path);
        if (v < 0 || v != Math.rint(v) || v > Integer.MAX_VALUE) {
            throw new ConfigurationException("Field 'octaves' at '" + path
                    + "' must be a non-negative integer, got " + node.get("octaves"));
        }
        return (int) v;
    }

    private static double requireMagnitude(JsonNode node, String path) {
        double v = requireNumber(node, "magnitude", path);
        if (!(v >= 0.0) || Double.isInfinite(v)) {
            throw new ConfigurationException("Field 'magnitude' at '" + path + "' must be >= 0, got " + v);
        }
        return v;
    }

    private static double requirePersistence(JsonNode node, String path) {
        double v = requireNumber(node, "persistence", path);
        if (!(v > 0.0) || Double.isInfinite(v)) {
            throw new ConfigurationException("Field 'persistence' at '" + path + "' must be > 0, got " + v);
        }
        return v;
    }

    private static long requireLong(JsonNode node, String field, String path) {
        JsonNode value = require(node, field, path);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ConfigurationException("Field '" + field + "' at '" + path + "' must be an integer");
        }
        return value.asLong();
    }

    private static double requireNumber(JsonNode node, String field, String path) {
        JsonNode value = require(node, field, path);
        if (!value.isNumber()) {
            throw new ConfigurationException("Field '" + field + "' at '" + path + "' must be a number");
        }
        return value.asDouble();
    }
}
