package com.trackforge.service;

import com.trackforge.model.AnalysisResult;
import com.trackforge.model.BatchExtractionRequest;
import com.trackforge.model.BatchExtractionResult;
import com.trackforge.model.ExtractionRequest;
import com.trackforge.model.ExtractionResult;
import com.trackforge.model.MediaFileList;
import com.trackforge.model.ProgressEvent;
import com.trackforge.model.SpecificTrackRequest;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Media operations available to the client.
 * <p>
 * Every operation runs in a worker process. Futures fail with a
 * {@link com.trackforge.service.exception.WorkerException}; when no worker can be launched the
 * methods throw {@link com.trackforge.service.exception.CapabilityUnavailableException} instead.
 */
public interface MediaWorkerApi {

    CompletableFuture<AnalysisResult> analyzeFile(Path file);

    CompletableFuture<ExtractionResult> extractTracks(ExtractionRequest request);

    CompletableFuture<ExtractionResult> extractSpecificTrack(SpecificTrackRequest request);

    CompletableFuture<BatchExtractionResult> batchExtract(BatchExtractionRequest request);

    CompletableFuture<MediaFileList> findMediaFiles(List<Path> paths);

    /**
     * Receive decoded progress of one operation; replaces any earlier subscriber for the id
     */
    ProgressSubscription subscribeProgress(String operationId, Consumer<ProgressEvent> handler);

    /**
     * Kill the worker running the operation
     * @return false when nothing was running under the id
     */
    boolean cancel(String operationId);
}
