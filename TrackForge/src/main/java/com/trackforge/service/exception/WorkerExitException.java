package com.trackforge.service.exception;

/**
 * The worker exited with a non-zero code
 */
public class WorkerExitException extends WorkerException {
    private final int exitCode;
    private final String stderr;

    public WorkerExitException(int exitCode, String stderr) {
        super("Worker process exited with code " + exitCode + ": " + stderr);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
