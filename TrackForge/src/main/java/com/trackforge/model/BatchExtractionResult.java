package com.trackforge.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.trackforge.util.JsonFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Report of a batch extraction.
 * <p>
 * A normal batch report carries no {@code success} field; the worker only adds
 * {@code success:false} with an {@code error} when the batch as a whole could not run.
 * Individual file failures are listed in {@code failedFilesList} and do not make the batch fail.
 */
public class BatchExtractionResult {
    private final Boolean success;
    private final String error;
    private final int totalFiles;
    private final int processedFiles;
    private final int successfulFiles;
    private final int failedFiles;
    private final int extractedTracks;
    private final List<FailedFile> failedFilesList;

    public BatchExtractionResult(Boolean success, String error, int totalFiles, int processedFiles,
                                 int successfulFiles, int failedFiles, int extractedTracks,
                                 List<FailedFile> failedFilesList) {
        this.success = success;
        this.error = error;
        this.totalFiles = totalFiles;
        this.processedFiles = processedFiles;
        this.successfulFiles = successfulFiles;
        this.failedFiles = failedFiles;
        this.extractedTracks = extractedTracks;
        this.failedFilesList = Collections.unmodifiableList(new ArrayList<>(failedFilesList));
    }

    public static BatchExtractionResult fromJson(JsonObject json) {
        List<FailedFile> failed = new ArrayList<>();
        for (JsonElement element : JsonFields.getArray(json, "failed_files_list")) {
            failed.add(FailedFile.fromJson(element));
        }
        return new BatchExtractionResult(
            JsonFields.getOptionalBoolean(json, "success"),
            JsonFields.getString(json, "error", null),
            JsonFields.getInt(json, "total_files", 0),
            JsonFields.getInt(json, "processed_files", 0),
            JsonFields.getInt(json, "successful_files", 0),
            JsonFields.getInt(json, "failed_files", failed.size()),
            JsonFields.getInt(json, "extracted_tracks", 0),
            failed
        );
    }

    /**
     * Explicit {@code success} wins; otherwise the batch succeeded unless an error is reported
     */
    public boolean isSuccess() {
        return success != null ? success : error == null;
    }

    public boolean hasFailures() {
        return !failedFilesList.isEmpty() || failedFiles > 0;
    }

    public String getError() { return error; }
    public int getTotalFiles() { return totalFiles; }
    public int getProcessedFiles() { return processedFiles; }
    public int getSuccessfulFiles() { return successfulFiles; }
    public int getFailedFiles() { return failedFiles; }
    public int getExtractedTracks() { return extractedTracks; }
    public List<FailedFile> getFailedFilesList() { return failedFilesList; }

    @Override
    public String toString() {
        return String.format("Batch: %d/%d files succeeded, %d failed, %d tracks extracted",
            successfulFiles, totalFiles, failedFiles, extractedTracks);
    }
}
