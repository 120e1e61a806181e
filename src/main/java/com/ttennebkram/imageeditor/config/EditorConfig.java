package com.ttennebkram.imageeditor.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Editor settings loaded from JSON.
 *
 * The bundled {@code /editor-defaults.json} provides every key. A user file named by
 * the {@value #CONFIG_PROPERTY} system property may override any subset of them;
 * objects are merged key by key so a partial "defaults" block is fine.
 */
public class EditorConfig {

    public static final String DEFAULTS_RESOURCE = "/editor-defaults.json";
    public static final String CONFIG_PROPERTY = "imageeditor.config";

    private static final Logger LOG = Logger.getLogger(EditorConfig.class.getName());
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private int historyCapacity = 20;
    private double zoomStep = 1.1;
    private double noiseStrength = 50.0;
    private double noiseMix = 0.15;
    private int fallbackViewportWidth = 800;
    private int fallbackViewportHeight = 600;
    private JsonObject defaults = new JsonObject();

    /**
     * Load the bundled defaults, then apply the user override file if the system property is set.
     */
    public static EditorConfig load() throws IOException {
        String overridePath = System.getProperty(CONFIG_PROPERTY);
        if (overridePath == null || overridePath.isBlank()) {
            return load(null);
        }
        return load(Path.of(overridePath));
    }

    /**
     * Load the bundled defaults merged with an optional override file.
     *
     * @param overrideFile JSON file with keys to override, or null
     */
    public static EditorConfig load(Path overrideFile) throws IOException {
        JsonObject merged = readDefaults();
        if (overrideFile != null) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                merge(merged, parseObject(reader, overrideFile.toString()));
            }
            LOG.info("Applied configuration overrides from " + overrideFile);
        }
        return fromJson(merged);
    }

    /**
     * Build a config from a JSON object. Missing keys keep their built-in values.
     *
     * @throws IllegalArgumentException if a value has the wrong type or is out of range
     */
    public static EditorConfig fromJson(JsonObject json) {
        EditorConfig config;
        try {
            config = GSON.fromJson(json, EditorConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration value: " + e.getMessage(), e);
        }
        if (config.defaults == null) {
            config.defaults = new JsonObject();
        }
        config.validate();
        return config;
    }

    /**
     * Config with the bundled defaults only.
     */
    public static EditorConfig defaults() {
        try {
            return fromJson(readDefaults());
        } catch (IOException e) {
            throw new IllegalStateException("Bundled " + DEFAULTS_RESOURCE + " is unreadable", e);
        }
    }

    private static JsonObject readDefaults() throws IOException {
        InputStream in = EditorConfig.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parseObject(reader, DEFAULTS_RESOURCE);
        }
    }

    private static JsonObject parseObject(Reader reader, String source) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid configuration " + source + ": not a JSON object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonSyntaxException e) {
            throw new IOException("Invalid configuration " + source + ": " + e.getMessage(), e);
        }
    }

    private static void merge(JsonObject target, JsonObject overrides) {
        for (Map.Entry<String, JsonElement> entry : overrides.entrySet()) {
            JsonElement existing = target.get(entry.getKey());
            if (existing != null && existing.isJsonObject() && entry.getValue().isJsonObject()) {
                merge(existing.getAsJsonObject(), entry.getValue().getAsJsonObject());
            } else {
                target.add(entry.getKey(), entry.getValue());
            }
        }
    }

    private void validate() {
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive: " + historyCapacity);
        }
        if (!(zoomStep > 1.0) || Double.isInfinite(zoomStep)) {
            throw new IllegalArgumentException("zoomStep must be greater than 1: " + zoomStep);
        }
        if (!(noiseMix >= 0.0 && noiseMix <= 1.0)) {
            throw new IllegalArgumentException("noiseMix must be within [0, 1]: " + noiseMix);
        }
        if (!(noiseStrength >= 0.0)) {
            throw new IllegalArgumentException("noiseStrength must not be negative: " + noiseStrength);
        }
        if (fallbackViewportWidth <= 0 || fallbackViewportHeight <= 0) {
            throw new IllegalArgumentException("fallback viewport must be positive: "
                    + fallbackViewportWidth + "x" + fallbackViewportHeight);
        }
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public double getZoomStep() {
        return zoomStep;
    }

    public double getNoiseStrength() {
        return noiseStrength;
    }

    public double getNoiseMix() {
        return noiseMix;
    }

    public int getFallbackViewportWidth() {
        return fallbackViewportWidth;
    }

    public int getFallbackViewportHeight() {
        return fallbackViewportHeight;
    }

    /**
     * Initial value for a control, as typed text. Falls back when the key is absent.
     */
    public String getDefaultText(String key, String fallback) {
        if (defaults.has(key) && defaults.get(key).isJsonPrimitive()) {
            return defaults.get(key).getAsString();
        }
        return fallback;
    }

    /**
     * Initial value for a slider. Falls back when the key is absent or not numeric.
     */
    public double getDefaultNumber(String key, double fallback) {
        if (defaults.has(key) && defaults.get(key).isJsonPrimitive()) {
            try {
                return defaults.get(key).getAsDouble();
            } catch (NumberFormatException e) {
                LOG.warning("Ignoring non-numeric default for " + key + ": " + defaults.get(key));
            }
        }
        return fallback;
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
