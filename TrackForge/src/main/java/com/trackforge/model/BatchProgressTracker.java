package com.trackforge.model;

import com.trackforge.util.ProgressCalculator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reduces per-file batch notifications into a file table and an overall percentage.
 * <p>
 * Events are keyed by file index only and may arrive in any order. Entries that reach
 * 100% leave the visible table; the completed counter is what tracks finished files.
 * Not thread-safe: confine to the thread that owns the extraction state.
 */
public class BatchProgressTracker {
    public static final String UNKNOWN_WORKER = "unknown";

    private final Map<Integer, FileProgressEntry> entries = new TreeMap<>();
    private final Set<Integer> completedIndexes = new HashSet<>();
    private int totalFiles;
    private int completedFiles;

    /**
     * Start tracking a new batch
     */
    public void reset(int totalFiles) {
        this.totalFiles = Math.max(0, totalFiles);
        this.completedFiles = 0;
        this.entries.clear();
        this.completedIndexes.clear();
    }

    /**
     * Apply one progress notification
     * @return true when the visible table or the counters changed
     */
    public boolean apply(ProgressEvent event) {
        KeyedProgress keyed = event.getKeyed();
        if (keyed == null) {
            return false;
        }

        boolean changed = false;
        Integer fileIndex = keyed.getFileIndex();

        if (fileIndex != null) {
            int percentage = event.resolvePercentage();
            String statusText = keyed.hasDescription()
                ? keyed.getDescription()
                : ProgressTextFormatter.batchText(event);
            String fileName = keyed.getFileName() != null && !keyed.getFileName().isEmpty()
                ? keyed.getFileName()
                : "File " + fileIndex;
            String workerId = keyed.getWorkerId() != null && !keyed.getWorkerId().isEmpty()
                ? keyed.getWorkerId()
                : UNKNOWN_WORKER;

            if (percentage >= 100) {
                changed = entries.remove(fileIndex) != null;
            } else {
                entries.put(fileIndex, new FileProgressEntry(fileIndex, fileName, percentage, statusText, workerId));
                changed = true;
            }
        }

        if (keyed.isSuccessfulCompletion() && ProgressTextFormatter.hasNonZeroCounters(keyed)) {
            if (fileIndex == null || completedIndexes.add(fileIndex)) {
                completedFiles++;
                changed = true;
            }
        }

        return changed;
    }

    /**
     * Mark every file of the batch as done
     */
    public void complete() {
        completedFiles = totalFiles;
    }

    public int overallProgress() {
        List<Integer> active = new ArrayList<>(entries.size());
        for (FileProgressEntry entry : entries.values()) {
            active.add(entry.getPercentage());
        }
        return ProgressCalculator.overallBatchProgress(completedFiles, totalFiles, active);
    }

    /**
     * Distinct worker ids among files in flight, for display
     */
    public Set<String> activeWorkers() {
        Set<String> workers = new LinkedHashSet<>();
        for (FileProgressEntry entry : entries.values()) {
            workers.add(entry.getWorkerId());
        }
        return workers;
    }

    public Map<Integer, FileProgressEntry> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getCompletedFiles() {
        return completedFiles;
    }
}
