package com.trackforge.service.exception;

/**
 * The worker exited cleanly but its output was not a single JSON value
 */
public class ResultParseException extends WorkerException {
    private final String output;

    public ResultParseException(String output, Throwable cause) {
        super("Failed to parse worker result: " + (cause != null ? cause.getMessage() : "empty output"), cause);
        this.output = output;
    }

    public String getOutput() {
        return output;
    }
}
