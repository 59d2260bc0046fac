package com.trackforge.service;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.trackforge.service.exception.ResultParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.function.Consumer;

/**
 * Splits a worker's stdout into progress notifications and the result body.
 * One instance per call; fed line by line from the stdout reader thread.
 */
public class WorkerOutputParser {
    private static final Logger logger = LoggerFactory.getLogger(WorkerOutputParser.class);

    public static final String PROGRESS_PREFIX = "PROGRESS:";

    private static final TypeAdapter<JsonElement> JSON_ELEMENT = new Gson().getAdapter(JsonElement.class);

    private final String operationId;
    private final Consumer<JsonObject> progressSink;
    private final StringBuilder body = new StringBuilder();
    private int progressCount;
    private int skippedCount;

    public WorkerOutputParser(String operationId, Consumer<JsonObject> progressSink) {
        this.operationId = operationId;
        this.progressSink = progressSink;
    }

    public void acceptLine(String line) {
        if (line == null || line.trim().isEmpty()) {
            return;
        }
        logger.trace("[{}] stdout: {}", operationId, line);

        if (line.startsWith(PROGRESS_PREFIX)) {
            handleProgress(line.substring(PROGRESS_PREFIX.length()));
            return;
        }

        if (body.length() > 0) {
            body.append('\n');
        }
        body.append(line);
    }

    private void handleProgress(String json) {
        JsonElement payload;
        try {
            payload = parseStrict(json);
        } catch (IOException | JsonParseException e) {
            skippedCount++;
            logger.warn("[{}] Skipping unparsable progress line: {}", operationId, e.getMessage());
            return;
        }

        if (!payload.isJsonObject()) {
            skippedCount++;
            logger.warn("[{}] Skipping progress line that is not an object: {}", operationId, json);
            return;
        }

        progressCount++;
        progressSink.accept(payload.getAsJsonObject());
    }

    /**
     * Parse the accumulated body as one JSON value
     */
    public JsonElement parseResult() throws ResultParseException {
        String text = body.toString().trim();
        if (text.isEmpty()) {
            throw new ResultParseException(text, null);
        }
        try {
            return parseStrict(text);
        } catch (IOException | JsonParseException e) {
            throw new ResultParseException(text, e);
        }
    }

    /**
     * Exactly one JSON value, no lenient literals, nothing trailing
     */
    static JsonElement parseStrict(String text) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        JsonElement element = JSON_ELEMENT.read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new JsonSyntaxException("Unexpected data after JSON value");
        }
        return element;
    }

    public String getBody() {
        return body.toString();
    }

    public int getProgressCount() {
        return progressCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }
}
