package com.trackforge.model;

/**
 * Progress of one file inside a running batch, keyed by its index
 */
public class FileProgressEntry {
    private final int index;
    private final String fileName;
    private final int percentage;
    private final String statusText;
    private final String workerId;

    public FileProgressEntry(int index, String fileName, int percentage, String statusText, String workerId) {
        this.index = index;
        this.fileName = fileName;
        this.percentage = Math.max(0, Math.min(100, percentage));
        this.statusText = statusText;
        this.workerId = workerId;
    }

    public int getIndex() { return index; }
    public String getFileName() { return fileName; }
    public int getPercentage() { return percentage; }
    public String getStatusText() { return statusText; }
    public String getWorkerId() { return workerId; }

    public boolean isFinished() {
        return percentage >= 100;
    }

    @Override
    public String toString() {
        return String.format("[%d] %s %d%% - %s (%s)", index, fileName, percentage, statusText, workerId);
    }
}
