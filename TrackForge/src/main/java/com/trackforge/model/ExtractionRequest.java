package com.trackforge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for extracting tracks from one file.
 * Serialised with Gson in camelCase; {@code operationId} is transient and never sent as a parameter.
 */
public class ExtractionRequest {
    private final String filePath;
    private final String outputDir;
    private final List<String> languages;
    private final boolean audioOnly;
    private final boolean subtitleOnly;
    private final boolean includeVideo;
    private final boolean videoOnly;
    private final boolean removeLetterbox;
    private final transient String operationId;

    public ExtractionRequest(String filePath, String outputDir, List<String> languages,
                             ExtractionOptions options, String operationId) {
        this.filePath = filePath;
        this.outputDir = outputDir;
        this.languages = new ArrayList<>(languages);
        this.audioOnly = options.isAudioOnly();
        this.subtitleOnly = options.isSubtitleOnly();
        this.includeVideo = options.isIncludeVideo();
        this.videoOnly = options.isVideoOnly();
        this.removeLetterbox = options.isRemoveLetterbox();
        this.operationId = operationId;
    }

    public String getFilePath() { return filePath; }
    public String getOutputDir() { return outputDir; }
    public List<String> getLanguages() { return languages; }
    public boolean isAudioOnly() { return audioOnly; }
    public boolean isSubtitleOnly() { return subtitleOnly; }
    public boolean isIncludeVideo() { return includeVideo; }
    public boolean isVideoOnly() { return videoOnly; }
    public boolean isRemoveLetterbox() { return removeLetterbox; }
    public String getOperationId() { return operationId; }
}
