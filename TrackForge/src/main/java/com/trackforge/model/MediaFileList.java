package com.trackforge.model;

import com.google.gson.JsonObject;
import com.trackforge.util.JsonFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Media files discovered under a set of input paths
 */
public class MediaFileList {
    private final boolean success;
    private final String error;
    private final List<String> files;

    public MediaFileList(boolean success, String error, List<String> files) {
        this.success = success;
        this.error = error;
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
    }

    public static MediaFileList fromJson(JsonObject json) {
        String error = JsonFields.getString(json, "error", null);
        return new MediaFileList(
            JsonFields.getBoolean(json, "success", error == null),
            error,
            JsonFields.getStringList(json, "files")
        );
    }

    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public List<String> getFiles() { return files; }

    public int getCount() {
        return files.size();
    }
}
