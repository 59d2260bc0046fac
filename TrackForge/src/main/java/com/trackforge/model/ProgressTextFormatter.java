package com.trackforge.model;

/**
 * Status lines shown while an extraction is running
 */
public final class ProgressTextFormatter {
    public static final String EXTRACTING_TRACKS = "Extracting tracks...";
    public static final String PROCESSING_FILES = "Processing files...";
    public static final String INITIALIZING = "Initializing extraction...";
    public static final String INITIALIZING_BATCH = "Initializing batch extraction...";
    public static final String SCANNING_DIRECTORY = "Scanning directory for media files...";
    public static final String ANALYZING_BATCH = "Analyzing batch files...";

    private ProgressTextFormatter() {
    }

    /**
     * "Extracting audio track 2 [eng]" when the event names a track, otherwise the generic line
     */
    public static String singleFileText(ProgressEvent event) {
        PositionalProgress positional = event.getPositional();
        if (positional == null) {
            return EXTRACTING_TRACKS;
        }

        String trackType = positional.getTrackType();
        String trackId = positional.getTrackId();
        if (trackType == null || trackId == null) {
            return EXTRACTING_TRACKS;
        }

        StringBuilder text = new StringBuilder("Extracting ")
            .append(trackType).append(" track ").append(trackId);
        String language = positional.getLanguage();
        if (!language.isEmpty()) {
            text.append(" [").append(language).append(']');
        }
        return text.toString();
    }

    /**
     * "Processing file 3/10" when counters are known, else the worker's description
     */
    public static String batchText(ProgressEvent event) {
        KeyedProgress keyed = event.getKeyed();
        if (keyed == null) {
            return PROCESSING_FILES;
        }
        if (hasNonZeroCounters(keyed)) {
            return "Processing file " + keyed.getCurrent() + "/" + keyed.getTotal();
        }
        if (keyed.hasDescription()) {
            return keyed.getDescription();
        }
        return PROCESSING_FILES;
    }

    public static String foundFiles(int count) {
        return "Found " + count + " media files";
    }

    static boolean hasNonZeroCounters(KeyedProgress keyed) {
        return keyed.hasCounters() && keyed.getCurrent() != 0 && keyed.getTotal() != 0;
    }
}
