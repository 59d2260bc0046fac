package com.trackforge.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One invocation of a worker function, identified by an opaque id
 */
public class Operation {
    private final String id;
    private final OperationKind kind;
    private volatile OperationStatus status;
    private volatile Instant startedAt;

    public Operation(String id, OperationKind kind) {
        this.id = id != null ? id : newId();
        this.kind = kind;
        this.status = OperationStatus.PENDING;
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public void markRunning() {
        this.status = OperationStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markFinished(boolean succeeded) {
        this.status = succeeded ? OperationStatus.SUCCEEDED : OperationStatus.FAILED;
    }

    public String getId() { return id; }
    public OperationKind getKind() { return kind; }
    public OperationStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }

    @Override
    public String toString() {
        return kind + "[" + id + "] " + status;
    }
}
