package com.trackforge.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.trackforge.util.ProgressCalculator;

/**
 * Positional form of a progress notification: {@code [trackType, trackId, percentage, language]}.
 * <p>
 * Batch workers reuse the same slots for {@code [current, total, percentage, trackType]},
 * so the first two values are kept as raw JSON and interpreted by the caller.
 */
public class PositionalProgress {
    private final JsonElement first;
    private final JsonElement second;
    private final JsonElement percentage;
    private final JsonElement language;
    private final int size;

    public PositionalProgress(JsonArray args) {
        this.size = args.size();
        this.first = valueAt(args, 0);
        this.second = valueAt(args, 1);
        this.percentage = valueAt(args, 2);
        this.language = valueAt(args, 3);
    }

    private static JsonElement valueAt(JsonArray args, int index) {
        if (index >= args.size()) {
            return null;
        }
        JsonElement element = args.get(index);
        return element == null || element.isJsonNull() ? null : element;
    }

    public int size() {
        return size;
    }

    /**
     * Whether index 2 carries a non-null percentage
     */
    public boolean hasPercentage() {
        return percentage != null;
    }

    public int getPercentage() {
        return ProgressCalculator.coerce(percentage);
    }

    public boolean isFirstNumeric() {
        return ProgressCalculator.isNumeric(first);
    }

    public int getFirstAsPercentage() {
        return ProgressCalculator.coerce(first);
    }

    /**
     * Track type at index 0, or null when absent or blank
     */
    public String getTrackType() {
        String value = asText(first);
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (isFirstNumeric() && first.getAsDouble() == 0) {
            return null;
        }
        return value;
    }

    /**
     * Track id at index 1, or null when absent
     */
    public String getTrackId() {
        return asText(second);
    }

    public String getLanguage() {
        String value = asText(language);
        return value != null ? value : "";
    }

    private static String asText(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        if (element.getAsJsonPrimitive().isNumber()) {
            double number = element.getAsDouble();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return String.valueOf((long) number);
            }
        }
        return element.getAsString();
    }

    @Override
    public String toString() {
        return String.format("[%s, %s, %s, %s]", first, second, percentage, language);
    }
}
