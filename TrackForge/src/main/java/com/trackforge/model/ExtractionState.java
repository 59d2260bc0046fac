package com.trackforge.model;

/**
 * Lifecycle of one extraction flow
 */
public enum ExtractionState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
