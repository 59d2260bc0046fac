package com.trackforge.model;

import com.google.gson.JsonObject;

/**
 * One decoded progress notification from a worker.
 * <p>
 * The worker envelope may carry a positional part ({@code args}), a keyed part
 * ({@code kwargs}) or both. Either part may be null.
 */
public class ProgressEvent {
    private final String operationId;
    private final PositionalProgress positional;
    private final KeyedProgress keyed;
    private final JsonObject payload;

    public ProgressEvent(String operationId, PositionalProgress positional, KeyedProgress keyed, JsonObject payload) {
        this.operationId = operationId;
        this.positional = positional;
        this.keyed = keyed;
        this.payload = payload;
    }

    public String getOperationId() { return operationId; }
    public PositionalProgress getPositional() { return positional; }
    public KeyedProgress getKeyed() { return keyed; }
    public JsonObject getPayload() { return payload; }

    public boolean hasPositional() {
        return positional != null;
    }

    public boolean hasKeyed() {
        return keyed != null;
    }

    /**
     * Resolve the percentage carried by this event.
     * Precedence: positional index 2, keyed {@code percentage} when numeric,
     * positional index 0 when numeric, otherwise 0. Always within [0, 100].
     */
    public int resolvePercentage() {
        if (positional != null && positional.hasPercentage()) {
            return positional.getPercentage();
        }
        if (keyed != null && keyed.hasNumericPercentage()) {
            return keyed.getPercentage();
        }
        if (positional != null && positional.isFirstNumeric()) {
            return positional.getFirstAsPercentage();
        }
        return 0;
    }

    public Integer getFileIndex() {
        return keyed != null ? keyed.getFileIndex() : null;
    }

    @Override
    public String toString() {
        return "ProgressEvent" + payload;
    }
}
