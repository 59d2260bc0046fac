package com.trackforge.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.trackforge.model.AnalysisResult;
import com.trackforge.model.BatchExtractionRequest;
import com.trackforge.model.BatchExtractionResult;
import com.trackforge.model.ExtractionRequest;
import com.trackforge.model.ExtractionResult;
import com.trackforge.model.MediaFileList;
import com.trackforge.model.OperationKind;
import com.trackforge.model.ProgressEvent;
import com.trackforge.model.SpecificTrackRequest;
import com.trackforge.service.exception.ResultParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link MediaWorkerApi} backed by {@link WorkerBridge}
 */
public class BridgeMediaWorkerApi implements MediaWorkerApi {
    private static final Logger logger = LoggerFactory.getLogger(BridgeMediaWorkerApi.class);
    private static final Gson gson = new Gson();

    private final WorkerBridge bridge;

    public BridgeMediaWorkerApi(WorkerBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    public CompletableFuture<AnalysisResult> analyzeFile(Path file) {
        logger.info("Analyzing file: {}", file);
        JsonArray args = new JsonArray();
        args.add(file.toString());
        return invoke(OperationKind.ANALYZE, args, null, AnalysisResult::fromJson);
    }

    @Override
    public CompletableFuture<ExtractionResult> extractTracks(ExtractionRequest request) {
        logger.info("Extracting tracks from: {}", request.getFilePath());
        return invoke(OperationKind.EXTRACT_SINGLE, toWorkerParams(request), request.getOperationId(), ExtractionResult::fromJson);
    }

    @Override
    public CompletableFuture<ExtractionResult> extractSpecificTrack(SpecificTrackRequest request) {
        logger.info("Extracting {} track {} from: {}", request.getTrackType(), request.getTrackId(), request.getFilePath());
        return invoke(OperationKind.EXTRACT_TRACK, toWorkerParams(request), request.getOperationId(), ExtractionResult::fromJson);
    }

    @Override
    public CompletableFuture<BatchExtractionResult> batchExtract(BatchExtractionRequest request) {
        logger.info("Batch extracting from {} paths", request.getInputPaths().size());
        return invoke(OperationKind.EXTRACT_BATCH, toWorkerParams(request), request.getOperationId(), BatchExtractionResult::fromJson);
    }

    @Override
    public CompletableFuture<MediaFileList> findMediaFiles(List<Path> paths) {
        logger.info("Finding media files in {} paths", paths.size());
        JsonArray pathArray = new JsonArray();
        for (Path path : paths) {
            pathArray.add(path.toString());
        }
        JsonObject args = new JsonObject();
        args.add("paths", pathArray);
        return invoke(OperationKind.FIND_FILES, args, null, MediaFileList::fromJson);
    }

    @Override
    public ProgressSubscription subscribeProgress(String operationId, Consumer<ProgressEvent> handler) {
        return bridge.getProgressChannel().subscribe(operationId,
            payload -> handler.accept(ProgressEventDecoder.decode(operationId, payload)));
    }

    @Override
    public boolean cancel(String operationId) {
        logger.info("Cancelling operation {}", operationId);
        return bridge.getSupervisor().terminate(operationId);
    }

    /**
     * Serialise a request in camelCase, then convert keys for the worker.
     * Transient fields (the operation id) are not part of the payload.
     */
    static JsonObject toWorkerParams(Object request) {
        return ParameterNaming.toWorkerNaming(gson.toJsonTree(request).getAsJsonObject());
    }

    private <T> CompletableFuture<T> invoke(OperationKind kind, JsonElement args, String operationId,
                                            Function<JsonObject, T> mapper) {
        return bridge.call(kind.getFunctionName(), args, operationId).thenApply(result -> {
            if (result == null || !result.isJsonObject()) {
                throw new CompletionException(new ResultParseException(String.valueOf(result),
                    new IllegalStateException("Expected a JSON object from " + kind.getFunctionName())));
            }
            return mapper.apply(result.getAsJsonObject());
        });
    }
}
