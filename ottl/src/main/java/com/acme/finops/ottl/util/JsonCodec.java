package com.acme.finops.ottl.util;

import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import com.acme.finops.ottl.pdata.Values;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Map;

/**
 * Shared JSON codec for configuration, JSON converters and metrics rendering.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * Renders an engine value (maps and slices included) as compact JSON.
     */
    public static String writeValue(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(Values.toRaw(value));
    }

    /**
     * Converts a JSON tree into engine values: objects become {@link PMap}, arrays
     * {@link PSlice}, integral numbers that fit a long become {@code Long}, other numbers
     * {@code Double}.
     */
    public static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            PMap out = new PMap();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                out.put(e.getKey(), toValue(e.getValue()));
            }
            return out;
        }
        if (node.isArray()) {
            PSlice out = new PSlice();
            for (JsonNode item : node) {
                out.add(toValue(item));
            }
            return out;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }
}
