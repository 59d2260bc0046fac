package com.trackforge.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Null-tolerant accessors for worker JSON objects
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static boolean isPresent(JsonObject json, String key) {
        return json != null && json.has(key) && !json.get(key).isJsonNull();
    }

    public static String getString(JsonObject json, String key, String defaultValue) {
        if (!isPresent(json, key) || !json.get(key).isJsonPrimitive()) {
            return defaultValue;
        }
        return json.get(key).getAsString();
    }

    public static int getInt(JsonObject json, String key, int defaultValue) {
        if (!isPresent(json, key) || !json.get(key).isJsonPrimitive()) {
            return defaultValue;
        }
        try {
            return json.get(key).getAsInt();
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean getBoolean(JsonObject json, String key, boolean defaultValue) {
        if (!isPresent(json, key) || !json.get(key).isJsonPrimitive()) {
            return defaultValue;
        }
        JsonElement value = json.get(key);
        return value.getAsJsonPrimitive().isBoolean() ? value.getAsBoolean() : defaultValue;
    }

    /**
     * Boolean field that distinguishes "absent" (null) from false
     */
    public static Boolean getOptionalBoolean(JsonObject json, String key) {
        if (!isPresent(json, key) || !json.get(key).isJsonPrimitive()
                || !json.get(key).getAsJsonPrimitive().isBoolean()) {
            return null;
        }
        return json.get(key).getAsBoolean();
    }

    public static JsonObject getObject(JsonObject json, String key) {
        if (!isPresent(json, key) || !json.get(key).isJsonObject()) {
            return null;
        }
        return json.getAsJsonObject(key);
    }

    public static JsonArray getArray(JsonObject json, String key) {
        if (!isPresent(json, key) || !json.get(key).isJsonArray()) {
            return new JsonArray();
        }
        return json.getAsJsonArray(key);
    }

    public static List<String> getStringList(JsonObject json, String key) {
        JsonArray array = getArray(json, key);
        if (array.size() == 0) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            if (element != null && element.isJsonPrimitive()) {
                values.add(element.getAsString());
            }
        }
        return values;
    }
}
