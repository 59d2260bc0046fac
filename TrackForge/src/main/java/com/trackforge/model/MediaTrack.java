package com.trackforge.model;

import com.google.gson.JsonObject;
import com.trackforge.util.JsonFields;

/**
 * One stream of a media container as reported by the analyzer
 */
public class MediaTrack {
    private final int id;
    private final String type;
    private final String codec;
    private final String language;
    private final String title;
    private final boolean defaultTrack;
    private final boolean forced;
    private final String displayName;

    public MediaTrack(int id, String type, String codec, String language, String title,
                      boolean defaultTrack, boolean forced, String displayName) {
        this.id = id;
        this.type = type;
        this.codec = codec;
        this.language = language;
        this.title = title;
        this.defaultTrack = defaultTrack;
        this.forced = forced;
        this.displayName = displayName;
    }

    public static MediaTrack fromJson(JsonObject json) {
        return new MediaTrack(
            JsonFields.getInt(json, "id", -1),
            JsonFields.getString(json, "type", "unknown"),
            JsonFields.getString(json, "codec", ""),
            JsonFields.getString(json, "language", ""),
            JsonFields.getString(json, "title", ""),
            JsonFields.getBoolean(json, "default", false),
            JsonFields.getBoolean(json, "forced", false),
            JsonFields.getString(json, "display_name", "")
        );
    }

    public int getId() { return id; }
    public String getType() { return type; }
    public String getCodec() { return codec; }
    public String getLanguage() { return language; }
    public String getTitle() { return title; }
    public boolean isDefaultTrack() { return defaultTrack; }
    public boolean isForced() { return forced; }
    public String getDisplayName() { return displayName; }

    @Override
    public String toString() {
        return displayName != null && !displayName.isEmpty()
            ? displayName
            : String.format("%s #%d (%s)", type, id, language);
    }
}
