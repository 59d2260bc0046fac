package com.trackforge.service;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.trackforge.model.KeyedProgress;
import com.trackforge.model.PositionalProgress;
import com.trackforge.model.ProgressEvent;

/**
 * Turns a raw progress payload into a {@link ProgressEvent}.
 * <p>
 * Enveloped payloads ({@code {"operationId", "args": [...], "kwargs": {...}}}) yield a positional
 * part from {@code args} and a keyed part from {@code kwargs}. A payload without either key is
 * read as keyed fields at the top level.
 */
public final class ProgressEventDecoder {

    private ProgressEventDecoder() {
    }

    public static ProgressEvent decode(String operationId, JsonObject payload) {
        JsonElement args = payload.get("args");
        JsonElement kwargs = payload.get("kwargs");
        boolean enveloped = payload.has("args") || payload.has("kwargs");

        PositionalProgress positional = args != null && args.isJsonArray()
            ? new PositionalProgress(args.getAsJsonArray())
            : null;

        KeyedProgress keyed;
        if (kwargs != null && kwargs.isJsonObject()) {
            keyed = new KeyedProgress(kwargs.getAsJsonObject());
        } else if (!enveloped) {
            keyed = new KeyedProgress(payload);
        } else {
            keyed = null;
        }

        String id = operationId;
        JsonElement payloadId = payload.get("operationId");
        if (id == null && payloadId != null && payloadId.isJsonPrimitive()) {
            id = payloadId.getAsString();
        }

        return new ProgressEvent(id, positional, keyed, payload);
    }
}
