package com.trackforge.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.trackforge.util.JsonFields;

/**
 * A batch input that could not be processed
 */
public class FailedFile {
    private final String path;
    private final String error;

    public FailedFile(String path, String error) {
        this.path = path;
        this.error = error;
    }

    /**
     * Read either a {@code [path, error]} pair or a {@code {"path", "error"}} object
     */
    public static FailedFile fromJson(JsonElement json) {
        if (json.isJsonArray()) {
            JsonArray pair = json.getAsJsonArray();
            String path = pair.size() > 0 && !pair.get(0).isJsonNull() ? pair.get(0).getAsString() : "";
            String error = pair.size() > 1 && !pair.get(1).isJsonNull() ? pair.get(1).getAsString() : "";
            return new FailedFile(path, error);
        }
        if (json.isJsonObject()) {
            JsonObject object = json.getAsJsonObject();
            return new FailedFile(JsonFields.getString(object, "path", ""), JsonFields.getString(object, "error", ""));
        }
        return new FailedFile(json.isJsonPrimitive() ? json.getAsString() : "", "");
    }

    public String getPath() { return path; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return path + ": " + error;
    }
}
