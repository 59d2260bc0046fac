package com.trackforge.service;

import com.google.gson.JsonObject;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The single active progress consumer of one operation.
 * Unsubscribing is idempotent and never removes a newer subscription for the same id.
 */
public class ProgressSubscription implements AutoCloseable {
    private final ProgressChannel channel;
    private final String operationId;
    private final Consumer<JsonObject> handler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ProgressSubscription(ProgressChannel channel, String operationId, Consumer<JsonObject> handler) {
        this.channel = channel;
        this.operationId = operationId;
        this.handler = handler;
    }

    public String getOperationId() {
        return operationId;
    }

    public boolean isActive() {
        return !closed.get();
    }

    public void unsubscribe() {
        if (closed.compareAndSet(false, true)) {
            channel.remove(this);
        }
    }

    @Override
    public void close() {
        unsubscribe();
    }

    /**
     * Replaced by a newer subscriber: stop delivering without touching the channel
     */
    void markReplaced() {
        closed.set(true);
    }

    void deliver(JsonObject payload) {
        if (!closed.get()) {
            handler.accept(payload);
        }
    }
}
