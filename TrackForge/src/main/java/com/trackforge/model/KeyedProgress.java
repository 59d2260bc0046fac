package com.trackforge.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.trackforge.util.ProgressCalculator;

/**
 * Keyed form of a progress notification.
 * Every field is optional; both the worker's snake_case keys and camelCase keys are read.
 */
public class KeyedProgress {
    private final JsonElement percentage;
    private final Integer current;
    private final Integer total;
    private final String description;
    private final String status;
    private final Boolean success;
    private final Integer fileIndex;
    private final String fileName;
    private final String workerId;

    public KeyedProgress(JsonObject fields) {
        this.percentage = first(fields, "percentage");
        this.current = intValue(first(fields, "current"));
        this.total = intValue(first(fields, "total"));
        this.description = textValue(first(fields, "description"));
        this.status = textValue(first(fields, "status"));
        this.success = booleanValue(first(fields, "success"));
        this.fileIndex = intValue(first(fields, "file_index", "fileIndex"));
        this.fileName = textValue(first(fields, "file_name", "fileName"));
        this.workerId = textValue(first(fields, "worker_id", "workerId", "thread_id", "threadId"));
    }

    private static JsonElement first(JsonObject fields, String... keys) {
        for (String key : keys) {
            JsonElement value = fields.get(key);
            if (value != null && !value.isJsonNull()) {
                return value;
            }
        }
        return null;
    }

    private static Integer intValue(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        try {
            return (int) Double.parseDouble(value.getAsString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String textValue(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static Boolean booleanValue(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        if (value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        return null;
    }

    /**
     * Whether {@code percentage} is present as a JSON number
     */
    public boolean hasNumericPercentage() {
        return ProgressCalculator.isNumeric(percentage);
    }

    public int getPercentage() {
        return ProgressCalculator.coerce(percentage);
    }

    public Integer getCurrent() { return current; }
    public Integer getTotal() { return total; }
    public String getDescription() { return description; }
    public String getStatus() { return status; }
    public Boolean getSuccess() { return success; }
    public Integer getFileIndex() { return fileIndex; }
    public String getFileName() { return fileName; }
    public String getWorkerId() { return workerId; }

    public boolean hasCounters() {
        return current != null && total != null;
    }

    public boolean hasDescription() {
        return description != null && !description.isEmpty();
    }

    /**
     * Terminal "this file finished successfully" notification
     */
    public boolean isSuccessfulCompletion() {
        return "complete".equals(status) && Boolean.TRUE.equals(success);
    }
}
