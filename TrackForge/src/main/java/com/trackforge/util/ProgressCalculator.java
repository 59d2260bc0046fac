package com.trackforge.util;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.util.Collection;

/**
 * Percentage coercion and batch progress arithmetic shared by the progress reducers
 */
public final class ProgressCalculator {

    private ProgressCalculator() {
    }

    /**
     * Clamp a raw percentage into [0, 100] and truncate it to an integer.
     * NaN is treated as 0.
     */
    public static int clamp(double percentage) {
        if (Double.isNaN(percentage)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(100, percentage));
    }

    /**
     * Coerce a percentage taken from a worker payload.
     * Numbers and numeric strings are clamped; null, JSON null, booleans,
     * containers and non-numeric strings all coerce to 0.
     */
    public static int coerce(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return 0;
        }

        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return clamp(primitive.getAsDouble());
        }
        if (primitive.isString()) {
            return coerce(primitive.getAsString());
        }
        return 0;
    }

    /**
     * Coerce a textual percentage ("42", " 42.5 ", "abc")
     */
    public static int coerce(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return clamp(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * True when the element is a JSON number (numeric strings do not count)
     */
    public static boolean isNumeric(JsonElement value) {
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber();
    }

    /**
     * Overall progress of a batch.
     * <p>
     * Completed files contribute a full share each, files in flight contribute their
     * average percentage weighted by how many of the total files they represent, and
     * files not yet started contribute nothing.
     *
     * @param completedFiles   files reported complete
     * @param totalFiles       files in the batch
     * @param activePercentages percentages of the files currently in flight
     * @return overall percentage, 0 when the batch is empty, never above 100
     */
    public static int overallBatchProgress(int completedFiles, int totalFiles, Collection<Integer> activePercentages) {
        if (totalFiles <= 0) {
            return 0;
        }

        int activeCount = activePercentages.size();
        long activeSum = 0;
        for (Integer percentage : activePercentages) {
            activeSum += percentage != null ? percentage : 0;
        }

        double completedWeight = ((double) completedFiles / totalFiles) * 100.0;
        double activeWeight = (double) activeCount / totalFiles;
        double activeProgress = ((double) activeSum / Math.max(activeCount, 1)) * activeWeight;

        return (int) Math.min(Math.round(completedWeight + activeProgress), 100);
    }
}
