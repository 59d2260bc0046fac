package com.trackforge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for a multi-file extraction
 */
public class BatchExtractionRequest {
    private final List<String> inputPaths;
    private final String outputDir;
    private final List<String> languages;
    private final boolean audioOnly;
    private final boolean subtitleOnly;
    private final boolean includeVideo;
    private final boolean videoOnly;
    private final boolean removeLetterbox;
    private final boolean useOrgStructure;
    private final int maxWorkers;
    private final transient String operationId;

    public BatchExtractionRequest(List<String> inputPaths, String outputDir, List<String> languages,
                                  ExtractionOptions options, boolean useOrgStructure, int maxWorkers,
                                  String operationId) {
        this.inputPaths = new ArrayList<>(inputPaths);
        this.outputDir = outputDir;
        this.languages = new ArrayList<>(languages);
        this.audioOnly = options.isAudioOnly();
        this.subtitleOnly = options.isSubtitleOnly();
        this.includeVideo = options.isIncludeVideo();
        this.videoOnly = options.isVideoOnly();
        this.removeLetterbox = options.isRemoveLetterbox();
        this.useOrgStructure = useOrgStructure;
        this.maxWorkers = maxWorkers;
        this.operationId = operationId;
    }

    public List<String> getInputPaths() { return inputPaths; }
    public String getOutputDir() { return outputDir; }
    public List<String> getLanguages() { return languages; }
    public boolean isAudioOnly() { return audioOnly; }
    public boolean isSubtitleOnly() { return subtitleOnly; }
    public boolean isIncludeVideo() { return includeVideo; }
    public boolean isVideoOnly() { return videoOnly; }
    public boolean isRemoveLetterbox() { return removeLetterbox; }
    public boolean isUseOrgStructure() { return useOrgStructure; }
    public int getMaxWorkers() { return maxWorkers; }
    public String getOperationId() { return operationId; }
}
