package com.questrail.scenario.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.ScenarioConfigurationException;

import java.util.Optional;

/**
 * Typed accessors over scenario document fragments.
 * <p>
 * Every accessor either returns a well-typed value or throws a
 * {@link ScenarioConfigurationException} carrying the fragment it was reading;
 * nothing falls back to a silent default unless the key is optional.
 */
public final class ConfigNodes
{
    private ConfigNodes() {}

    /**
     * Returns the child under {@code key}, which must be present and not null.
     */
    public static JsonNode requireNode(JsonNode node, String key) {
        JsonNode value = mapping(node, key).get(key);
        if (value == null || value.isNull()) {
            throw new ScenarioConfigurationException("Missing required key '" + key + "'", node);
        }
        return value;
    }

    /**
     * Returns the scalar under {@code key} as text.
     */
    public static String requireText(JsonNode node, String key) {
        JsonNode value = requireNode(node, key);
        if (!value.isValueNode()) {
            throw new ScenarioConfigurationException("Key '" + key + "' must be a scalar", node);
        }
        return value.asText();
    }

    /**
     * Returns the number under {@code key}.
     */
    public static double requireDouble(JsonNode node, String key) {
        JsonNode value = requireNode(node, key);
        if (!value.isNumber()) {
            throw new ScenarioConfigurationException("Key '" + key + "' must be a number", node);
        }
        return value.asDouble();
    }

    /**
     * Returns the integer under {@code key}.
     */
    public static int requireInt(JsonNode node, String key) {
        JsonNode value = requireNode(node, key);
        return asInt(value, key, node);
    }

    /**
     * Interprets a scalar as an integer, failing with {@code context} as the
     * reported fragment.
     */
    public static int asInt(JsonNode value, String what, JsonNode context) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ScenarioConfigurationException("'" + what + "' must be an integer", context);
        }
        return value.intValue();
    }

    public static Optional<String> optionalText(JsonNode node, String key) {
        JsonNode value = mapping(node, key).get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isValueNode()) {
            throw new ScenarioConfigurationException("Key '" + key + "' must be a scalar", node);
        }
        return Optional.of(value.asText());
    }

    public static boolean optionalBoolean(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = mapping(node, key).get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new ScenarioConfigurationException("Key '" + key + "' must be a boolean", node);
        }
        return value.booleanValue();
    }

    private static JsonNode mapping(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            throw new ScenarioConfigurationException(
                    "Expected a mapping holding key '" + key + "'", node);
        }
        return node;
    }
}
