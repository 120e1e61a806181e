package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Builder for transform parameter payloads.
 *
 * Usage:
 *   JsonObject params = TransformParams.builder().put("factor", 1.5).build();
 *   JsonObject typed = TransformParams.of("tx", "50", "ty", "-10");
 */
public final class TransformParams {

    private final JsonObject json = new JsonObject();

    private TransformParams() {
    }

    public static TransformParams builder() {
        return new TransformParams();
    }

    public static JsonObject empty() {
        return new JsonObject();
    }

    /**
     * Build a payload from alternating key/value pairs. Values may be numbers, strings,
     * booleans or JSON elements.
     */
    public static JsonObject of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " items");
        }
        TransformParams params = builder();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            params.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return params.build();
    }

    public TransformParams put(String key, Object value) {
        if (value == null) {
            json.remove(key);
        } else if (value instanceof Number) {
            json.addProperty(key, (Number) value);
        } else if (value instanceof Boolean) {
            json.addProperty(key, (Boolean) value);
        } else if (value instanceof JsonElement) {
            json.add(key, (JsonElement) value);
        } else {
            json.addProperty(key, value.toString());
        }
        return this;
    }

    public JsonObject build() {
        return json.deepCopy();
    }
}
