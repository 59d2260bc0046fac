package com.trackforge.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.trackforge.util.JsonFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracks and languages found in a media file.
 * Batch analysis reuses this type for the sample file, with {@code sampleFile}
 * and {@code totalFiles} filled in.
 */
public class AnalysisResult {
    private final boolean success;
    private final String error;
    private final List<MediaTrack> tracks;
    private final int audioTracks;
    private final int subtitleTracks;
    private final int videoTracks;
    private final List<String> audioLanguages;
    private final List<String> subtitleLanguages;
    private final List<String> videoLanguages;
    private String sampleFile;
    private int totalFiles;

    public AnalysisResult(boolean success, String error, List<MediaTrack> tracks,
                          int audioTracks, int subtitleTracks, int videoTracks,
                          List<String> audioLanguages, List<String> subtitleLanguages,
                          List<String> videoLanguages) {
        this.success = success;
        this.error = error;
        this.tracks = Collections.unmodifiableList(new ArrayList<>(tracks));
        this.audioTracks = audioTracks;
        this.subtitleTracks = subtitleTracks;
        this.videoTracks = videoTracks;
        this.audioLanguages = Collections.unmodifiableList(new ArrayList<>(audioLanguages));
        this.subtitleLanguages = Collections.unmodifiableList(new ArrayList<>(subtitleLanguages));
        this.videoLanguages = Collections.unmodifiableList(new ArrayList<>(videoLanguages));
    }

    public static AnalysisResult fromJson(JsonObject json) {
        List<MediaTrack> tracks = new ArrayList<>();
        for (JsonElement element : JsonFields.getArray(json, "tracks")) {
            if (element.isJsonObject()) {
                tracks.add(MediaTrack.fromJson(element.getAsJsonObject()));
            }
        }

        JsonObject languages = JsonFields.getObject(json, "languages");
        String error = JsonFields.getString(json, "error", null);

        AnalysisResult result = new AnalysisResult(
            JsonFields.getBoolean(json, "success", error == null),
            error,
            tracks,
            JsonFields.getInt(json, "audio_tracks", 0),
            JsonFields.getInt(json, "subtitle_tracks", 0),
            JsonFields.getInt(json, "video_tracks", 0),
            JsonFields.getStringList(languages, "audio"),
            JsonFields.getStringList(languages, "subtitle"),
            JsonFields.getStringList(languages, "video")
        );
        result.sampleFile = JsonFields.getString(json, "sample_file", null);
        result.totalFiles = JsonFields.getInt(json, "total_files", 0);
        return result;
    }

    /**
     * Copy of this result describing a batch through one sample file
     */
    public AnalysisResult asBatchSummary(String sampleFile, int totalFiles) {
        AnalysisResult summary = new AnalysisResult(success, error, tracks, audioTracks, subtitleTracks,
            videoTracks, audioLanguages, subtitleLanguages, videoLanguages);
        summary.sampleFile = sampleFile;
        summary.totalFiles = totalFiles;
        return summary;
    }

    /**
     * Audio and subtitle languages combined, first occurrence order, no duplicates
     */
    public List<String> availableLanguages() {
        Set<String> languages = new LinkedHashSet<>(audioLanguages);
        languages.addAll(subtitleLanguages);
        return new ArrayList<>(languages);
    }

    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public List<MediaTrack> getTracks() { return tracks; }
    public int getAudioTracks() { return audioTracks; }
    public int getSubtitleTracks() { return subtitleTracks; }
    public int getVideoTracks() { return videoTracks; }
    public List<String> getAudioLanguages() { return audioLanguages; }
    public List<String> getSubtitleLanguages() { return subtitleLanguages; }
    public List<String> getVideoLanguages() { return videoLanguages; }
    public String getSampleFile() { return sampleFile; }
    public int getTotalFiles() { return totalFiles; }
}
