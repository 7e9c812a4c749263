package io.surfworks.evalhub.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.evalhub.model.ConfigMap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Jackson trees and plain Java values.
 *
 * <p>Objects become insertion-ordered maps, arrays become lists, integral numbers
 * become {@code Integer} or {@code Long}, other numbers {@code Double}.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Converts a JSON node to plain Java values.
     */
    public static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toJava(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                list.add(toJava(element));
            }
            return list;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    /**
     * Converts a JSON object to a {@link ConfigMap}. Non-objects yield an empty map.
     */
    public static ConfigMap toConfigMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ConfigMap.empty();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), toJava(field.getValue()));
        }
        return ConfigMap.of(map);
    }

    /**
     * Converts a plain Java value (as produced by {@link #toJava}) back to a tree.
     */
    public static JsonNode toNode(ObjectMapper mapper, Object value) {
        return mapper.valueToTree(value);
    }
}
