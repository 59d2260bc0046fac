package com.trackforge.service.exception;

/**
 * The worker runtime or entry script is missing, so no capability can be invoked
 */
public class CapabilityUnavailableException extends RuntimeException {

    public CapabilityUnavailableException(String message) {
        super(message);
    }
}
