package com.trackforge.model;

/**
 * Individually toggleable extraction flags
 */
public enum ExtractionOption {
    AUDIO_ONLY,
    SUBTITLE_ONLY,
    VIDEO_ONLY,
    INCLUDE_VIDEO,
    REMOVE_LETTERBOX
}
