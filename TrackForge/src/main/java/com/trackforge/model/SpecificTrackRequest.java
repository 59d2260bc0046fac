package com.trackforge.model;

/**
 * Parameters for extracting a single track by type and id
 */
public class SpecificTrackRequest {
    private final String filePath;
    private final String outputDir;
    private final String trackType;
    private final int trackId;
    private final boolean removeLetterbox;
    private final transient String operationId;

    public SpecificTrackRequest(String filePath, String outputDir, String trackType, int trackId,
                                boolean removeLetterbox, String operationId) {
        this.filePath = filePath;
        this.outputDir = outputDir;
        this.trackType = trackType;
        this.trackId = trackId;
        this.removeLetterbox = removeLetterbox;
        this.operationId = operationId;
    }

    public String getFilePath() { return filePath; }
    public String getOutputDir() { return outputDir; }
    public String getTrackType() { return trackType; }
    public int getTrackId() { return trackId; }
    public boolean isRemoveLetterbox() { return removeLetterbox; }
    public String getOperationId() { return operationId; }
}
