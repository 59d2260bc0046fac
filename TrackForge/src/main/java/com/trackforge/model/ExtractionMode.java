package com.trackforge.model;

public enum ExtractionMode {
    SINGLE,
    BATCH
}
