package com.trackforge.service;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Map;
import java.util.function.Function;

/**
 * Key conversion between the client's camelCase and the worker's snake_case.
 * Nested objects are converted; array elements are passed through untouched.
 */
public final class ParameterNaming {

    private ParameterNaming() {
    }

    public static JsonObject toWorkerNaming(JsonObject params) {
        return convert(params, ParameterNaming::camelToSnake);
    }

    public static JsonObject toUiNaming(JsonObject params) {
        return convert(params, ParameterNaming::snakeToCamel);
    }

    private static JsonObject convert(JsonObject source, Function<String, String> keyMapper) {
        JsonObject converted = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : source.entrySet()) {
            JsonElement value = entry.getValue();
            if (value != null && value.isJsonObject()) {
                value = convert(value.getAsJsonObject(), keyMapper);
            }
            converted.add(keyMapper.apply(entry.getKey()), value);
        }
        return converted;
    }

    /**
     * "maxWorkers" -> "max_workers"
     */
    public static String camelToSnake(String key) {
        StringBuilder result = new StringBuilder(key.length() + 4);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                result.append('_').append((char) (c + ('a' - 'A')));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * "max_workers" -> "maxWorkers"
     */
    public static String snakeToCamel(String key) {
        StringBuilder result = new StringBuilder(key.length());
        boolean upperNext = false;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '_' && i + 1 < key.length() && key.charAt(i + 1) >= 'a' && key.charAt(i + 1) <= 'z') {
                upperNext = true;
            } else if (upperNext) {
                result.append((char) (c - ('a' - 'A')));
                upperNext = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
