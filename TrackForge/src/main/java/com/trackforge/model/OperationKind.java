package com.trackforge.model;

/**
 * Kinds of work delegated to a worker process, with the worker function each one invokes
 */
public enum OperationKind {
    ANALYZE("analyze_file"),
    EXTRACT_SINGLE("extract_tracks"),
    EXTRACT_TRACK("extract_specific_track"),
    EXTRACT_BATCH("batch_extract"),
    FIND_FILES("find_media_files_in_paths");

    private final String functionName;

    OperationKind(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
