package com.trackforge.model;

import com.google.gson.JsonObject;
import com.trackforge.util.JsonFields;

/**
 * Outcome of extracting tracks from one file.
 * Also used for single-track extraction, which fills {@code trackType}, {@code trackId}
 * and {@code outputPath} instead of the counters.
 */
public class ExtractionResult {
    private final boolean success;
    private final String file;
    private final int extractedAudio;
    private final int extractedSubtitles;
    private final int extractedVideo;
    private final String error;
    private final String trackType;
    private final Integer trackId;
    private final String outputPath;

    public ExtractionResult(boolean success, String file, int extractedAudio, int extractedSubtitles,
                            int extractedVideo, String error, String trackType, Integer trackId,
                            String outputPath) {
        this.success = success;
        this.file = file;
        this.extractedAudio = extractedAudio;
        this.extractedSubtitles = extractedSubtitles;
        this.extractedVideo = extractedVideo;
        this.error = error;
        this.trackType = trackType;
        this.trackId = trackId;
        this.outputPath = outputPath;
    }

    public static ExtractionResult fromJson(JsonObject json) {
        String error = JsonFields.getString(json, "error", null);
        return new ExtractionResult(
            JsonFields.getBoolean(json, "success", error == null),
            JsonFields.getString(json, "file", null),
            JsonFields.getInt(json, "extracted_audio", 0),
            JsonFields.getInt(json, "extracted_subtitles", 0),
            JsonFields.getInt(json, "extracted_video", 0),
            error,
            JsonFields.getString(json, "track_type", null),
            JsonFields.isPresent(json, "track_id") ? JsonFields.getInt(json, "track_id", 0) : null,
            JsonFields.getString(json, "output_path", null)
        );
    }

    public int getTotalExtracted() {
        return extractedAudio + extractedSubtitles + extractedVideo;
    }

    public boolean isSuccess() { return success; }
    public String getFile() { return file; }
    public int getExtractedAudio() { return extractedAudio; }
    public int getExtractedSubtitles() { return extractedSubtitles; }
    public int getExtractedVideo() { return extractedVideo; }
    public String getError() { return error; }
    public String getTrackType() { return trackType; }
    public Integer getTrackId() { return trackId; }
    public String getOutputPath() { return outputPath; }

    @Override
    public String toString() {
        if (!success) {
            return "Extraction failed: " + error;
        }
        if (outputPath != null) {
            return String.format("Extracted %s track %s to %s", trackType, trackId, outputPath);
        }
        return String.format("Extracted %d audio, %d subtitle, %d video tracks", extractedAudio, extractedSubtitles, extractedVideo);
    }
}
