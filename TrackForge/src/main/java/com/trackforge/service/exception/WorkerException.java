package com.trackforge.service.exception;

import java.io.IOException;

/**
 * Base type for failures of a worker call
 */
public class WorkerException extends IOException {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
