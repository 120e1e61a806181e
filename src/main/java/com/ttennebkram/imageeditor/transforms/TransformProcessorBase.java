package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Abstract base class for transform processors.
 * Provides the annotation-backed metadata and parameter parsing helpers.
 */
public abstract class TransformProcessorBase implements TransformProcessor {

    @Override
    public OperationKind getOperation() {
        return info().operation();
    }

    @Override
    public String getDescription() {
        String description = info().description();
        return description.isEmpty() ? getOperation().getDisplayName() : description;
    }

    private TransformInfo info() {
        TransformInfo info = getClass().getAnnotation(TransformInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @TransformInfo");
        }
        return info;
    }

    /**
     * Read a required finite number. Accepts JSON numbers and numeric strings.
     */
    protected double requireDouble(JsonObject json, String key) throws InvalidParameterException {
        JsonPrimitive value = requirePrimitive(json, key);
        double parsed;
        try {
            parsed = value.isNumber() ? value.getAsDouble() : Double.parseDouble(value.getAsString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(key, "Not a number: '" + value.getAsString() + "'", e);
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new InvalidParameterException(key, "Not a finite number: " + value.getAsString());
        }
        return parsed;
    }

    /**
     * Read an optional finite number, falling back when the key is absent.
     */
    protected double getDouble(JsonObject json, String key, double defaultValue) throws InvalidParameterException {
        if (!json.has(key) || json.get(key).isJsonNull()) {
            return defaultValue;
        }
        return requireDouble(json, key);
    }

    /**
     * Read a required integer. JSON numbers must be integral; strings must parse as integers,
     * so "50" is accepted and "50.5" is not.
     */
    protected int requireInt(JsonObject json, String key) throws InvalidParameterException {
        JsonPrimitive value = requirePrimitive(json, key);
        if (value.isNumber()) {
            double number = value.getAsDouble();
            if (number != Math.rint(number) || Math.abs(number) > Integer.MAX_VALUE) {
                throw new InvalidParameterException(key, "Not an integer: " + value.getAsString());
            }
            return (int) number;
        }
        try {
            return Integer.parseInt(value.getAsString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(key, "Not an integer: '" + value.getAsString() + "'", e);
        }
    }

    /**
     * Read an optional integral long, e.g. a random seed.
     */
    protected Long getLong(JsonObject json, String key) throws InvalidParameterException {
        if (!json.has(key) || json.get(key).isJsonNull()) {
            return null;
        }
        JsonPrimitive value = requirePrimitive(json, key);
        try {
            return value.isNumber() ? value.getAsLong() : Long.parseLong(value.getAsString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(key, "Not an integer: '" + value.getAsString() + "'", e);
        }
    }

    /**
     * Read a required non-blank string.
     */
    protected String requireString(JsonObject json, String key) throws InvalidParameterException {
        String value = requirePrimitive(json, key).getAsString().trim();
        if (value.isEmpty()) {
            throw new InvalidParameterException(key, "Missing value for " + key);
        }
        return value;
    }

    private JsonPrimitive requirePrimitive(JsonObject json, String key) throws InvalidParameterException {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            throw new InvalidParameterException(key, "Missing parameter " + key);
        }
        if (!element.isJsonPrimitive()) {
            throw new InvalidParameterException(key, "Expected a single value for " + key + ", got " + element);
        }
        return element.getAsJsonPrimitive();
    }
}
