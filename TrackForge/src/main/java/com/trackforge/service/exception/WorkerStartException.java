package com.trackforge.service.exception;

/**
 * The worker process could not be launched
 */
public class WorkerStartException extends WorkerException {

    public WorkerStartException(String message) {
        super("Failed to start worker process: " + message);
    }

    public WorkerStartException(String message, Throwable cause) {
        super("Failed to start worker process: " + message, cause);
    }
}
