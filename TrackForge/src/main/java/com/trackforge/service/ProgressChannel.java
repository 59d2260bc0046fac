package com.trackforge.service;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Routes progress payloads to at most one consumer per operation id.
 * Payloads for ids without a consumer are dropped.
 */
public class ProgressChannel {
    private static final Logger logger = LoggerFactory.getLogger(ProgressChannel.class);

    private final Map<String, ProgressSubscription> subscriptions = new ConcurrentHashMap<>();

    /**
     * Register the consumer for an operation, closing any previous one
     */
    public ProgressSubscription subscribe(String operationId, Consumer<JsonObject> handler) {
        ProgressSubscription subscription = new ProgressSubscription(this, operationId, handler);
        ProgressSubscription previous = subscriptions.put(operationId, subscription);
        if (previous != null) {
            logger.debug("Replacing progress subscriber for operation {}", operationId);
            previous.markReplaced();
        }
        return subscription;
    }

    public void publish(String operationId, JsonObject payload) {
        ProgressSubscription subscription = subscriptions.get(operationId);
        if (subscription == null) {
            logger.trace("No subscriber for operation {}, dropping progress", operationId);
            return;
        }
        try {
            subscription.deliver(payload);
        } catch (RuntimeException e) {
            logger.error("Progress subscriber for operation {} failed", operationId, e);
        }
    }

    public boolean hasSubscriber(String operationId) {
        return subscriptions.containsKey(operationId);
    }

    void remove(ProgressSubscription subscription) {
        subscriptions.remove(subscription.getOperationId(), subscription);
    }
}
