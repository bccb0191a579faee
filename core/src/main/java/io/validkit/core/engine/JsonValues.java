package io.validkit.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.validkit.core.model.Values;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson tree helpers: JSLT truthiness and conversion of a tree into the plain Java values the
 * schema engine consumes.
 *
 * <p>Thread-safe; stateless utility class.
 */
public final class JsonValues {

    private JsonValues() {}

    /**
     * Truthiness of a condition result, by the rule {@link Values#isTruthy} applies to plain
     * values: absent, JSON {@code null} and {@code false} are falsy; empty strings, zero and empty
     * containers are truthy.
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Values.isTruthy(null);
        }
        return Values.isTruthy(node.isBoolean() ? node.booleanValue() : node);
    }

    /**
     * Converts a tree to plain Java values: objects to ordered maps, arrays to lists, integral
     * numbers to {@code Long} (or {@code BigInteger} when they do not fit), {@code BigDecimal}
     * nodes to {@code BigDecimal}, other floating numbers to {@code Double}, text to {@code
     * String}, and null or missing nodes to {@code null}.
     */
    public static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                map.put(entry.getKey(), toJava(entry.getValue()));
            }
            return Collections.unmodifiableMap(map);
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(item -> list.add(toJava(item)));
            return Collections.unmodifiableList(list);
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isBigDecimal()) {
            return node.decimalValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBinary() || node.isPojo()) {
            return node.toString();
        }
        return node.asText();
    }
}
