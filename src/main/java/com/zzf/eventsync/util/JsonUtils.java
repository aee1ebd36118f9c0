package com.zzf.eventsync.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape-checked field access on loosely typed event payloads. Every accessor answers {@code null}
 * (or an empty value) when the field is absent or has the wrong JSON type.
 */
public final class JsonUtils {

    private JsonUtils() {}

    /** First key whose value is a JSON string. */
    public static String textOrNull(JsonNode node, String... keys) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }

    public static String textOrDefault(JsonNode node, String key, String fallback) {
        String value = textOrNull(node, key);
        return value != null ? value : fallback;
    }

    public static Long longOrNull(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(key);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    public static Integer intOrNull(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(key);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    /** The object under {@code key}, or {@code null}. */
    public static JsonNode objectOrNull(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(key);
        return value != null && value.isObject() ? value : null;
    }

    /** The object under {@code key}, or a fresh empty object. */
    public static ObjectNode objectOrEmpty(JsonNode node, String key) {
        JsonNode value = objectOrNull(node, key);
        return value != null ? (ObjectNode) value : JsonNodeFactory.instance.objectNode();
    }

    /** String elements of the array under {@code key}; non-string elements are skipped. */
    public static List<String> textArray(JsonNode node, String key) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        JsonNode value = node.get(key);
        if (value == null || !value.isArray()) {
            return out;
        }
        for (JsonNode element : value) {
            if (element.isTextual()) {
                out.add(element.asText());
            }
        }
        return out;
    }

    /** The node itself when it is an object, otherwise an empty object. */
    public static ObjectNode asObject(JsonNode node) {
        return node != null && node.isObject() ? (ObjectNode) node : JsonNodeFactory.instance.objectNode();
    }
}
