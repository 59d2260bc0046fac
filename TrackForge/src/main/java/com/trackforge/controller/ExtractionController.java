package com.trackforge.controller;

import com.google.gson.JsonObject;
import com.trackforge.model.AnalysisResult;
import com.trackforge.model.AppSettings;
import com.trackforge.model.BatchExtractionRequest;
import com.trackforge.model.BatchExtractionResult;
import com.trackforge.model.BatchProgressTracker;
import com.trackforge.model.ExtractionMode;
import com.trackforge.model.ExtractionOption;
import com.trackforge.model.ExtractionOptions;
import com.trackforge.model.ExtractionRequest;
import com.trackforge.model.ExtractionResult;
import com.trackforge.model.ExtractionState;
import com.trackforge.model.FileProgressEntry;
import com.trackforge.model.MediaFileList;
import com.trackforge.model.Operation;
import com.trackforge.model.OperationKind;
import com.trackforge.model.ProgressEvent;
import com.trackforge.model.ProgressTextFormatter;
import com.trackforge.service.MediaWorkerApi;
import com.trackforge.service.ProgressSubscription;
import com.trackforge.service.exception.CapabilityUnavailableException;
import com.trackforge.util.SystemResourceManager;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.collections.ObservableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Drives single-file and batch extraction and reduces worker progress into observable state.
 * <p>
 * All state lives on the UI executor. Worker callbacks are marshalled onto it, so the
 * properties can be bound directly by views. The controller does not prevent a second
 * extraction while one is running; views disable the action through {@link #extractingProperty()}.
 */
public class ExtractionController {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionController.class);

    private final MediaWorkerApi api;
    private final Executor uiExecutor;
    private final SystemResourceManager resources;
    private final BatchProgressTracker batchTracker = new BatchProgressTracker();

    // Inputs
    private final StringProperty filePath = new SimpleStringProperty("");
    private final StringProperty outputPath = new SimpleStringProperty("");
    private final ObjectProperty<AnalysisResult> analysis = new SimpleObjectProperty<>();

    // Extraction status
    private final ObjectProperty<ExtractionState> state = new SimpleObjectProperty<>(ExtractionState.IDLE);
    private final BooleanProperty extracting = new SimpleBooleanProperty(false);
    private final ObjectProperty<ExtractionResult> extractionResult = new SimpleObjectProperty<>();
    private final ObjectProperty<BatchExtractionResult> batchResult = new SimpleObjectProperty<>();
    private final StringProperty error = new SimpleStringProperty();

    // Progress
    private final IntegerProperty progressValue = new SimpleIntegerProperty(0);
    private final StringProperty progressText = new SimpleStringProperty(ProgressTextFormatter.EXTRACTING_TRACKS);
    private final ObservableMap<Integer, FileProgressEntry> fileProgressMap = FXCollections.observableHashMap();
    private final IntegerProperty totalBatchFiles = new SimpleIntegerProperty(0);
    private final IntegerProperty processedBatchFiles = new SimpleIntegerProperty(0);

    // User options
    private final ObservableList<String> selectedLanguages = FXCollections.observableArrayList("eng");
    private final ObjectProperty<ExtractionOptions> extractionOptions = new SimpleObjectProperty<>(ExtractionOptions.defaults());

    // Batch configuration
    private final BooleanProperty batchMode = new SimpleBooleanProperty(false);
    private final ObservableList<String> inputPaths = FXCollections.observableArrayList();
    private final IntegerProperty maxWorkers = new SimpleIntegerProperty();
    private final ObjectProperty<AnalysisResult> batchAnalyzed = new SimpleObjectProperty<>();
    private final BooleanProperty batchAnalyzing = new SimpleBooleanProperty(false);
    private boolean useOrgStructure = true;

    // Current run
    private Operation currentOperation;
    private ExtractionMode currentMode;
    private ProgressSubscription subscription;
    private JsonObject lastPayload;
    private boolean cancelRequested;

    public ExtractionController(MediaWorkerApi api, Executor uiExecutor) {
        this(api, uiExecutor, SystemResourceManager.getInstance());
    }

    public ExtractionController(MediaWorkerApi api, Executor uiExecutor, SystemResourceManager resources) {
        this.api = api;
        this.uiExecutor = uiExecutor;
        this.resources = resources;
        this.maxWorkers.set(resources.getDefaultBatchWorkers());
    }

    /**
     * Take saved preferences as the starting point of a session
     */
    public void applySettings(AppSettings settings) {
        if (!settings.getDefaultLanguages().isEmpty()) {
            selectedLanguages.setAll(settings.getDefaultLanguages());
        }
        extractionOptions.set(settings.getExtractionOptions());
        if (settings.getMaxWorkers() > 0) {
            setMaxWorkers(settings.getMaxWorkers());
        }
        if (settings.getOutputDirectory() != null && !settings.getOutputDirectory().isEmpty()) {
            outputPath.set(settings.getOutputDirectory());
        }
        useOrgStructure = settings.isUseOrgStructure();
    }

    // ========== Extraction ==========

    /**
     * Start an extraction in the current mode
     * @return completes with the final state once the run is over (immediately when validation fails)
     */
    public CompletableFuture<ExtractionState> extract() {
        ExtractionMode mode = batchMode.get() ? ExtractionMode.BATCH : ExtractionMode.SINGLE;
        switch (mode) {
            case BATCH:
                return extractBatch();
            case SINGLE:
            default:
                return extractSingle();
        }
    }

    private CompletableFuture<ExtractionState> extractSingle() {
        if (isBlank(filePath.get())) {
            return rejected("Please select a file first");
        }
        if (isBlank(outputPath.get())) {
            return rejected("Please select an output directory");
        }
        if (analysis.get() == null) {
            return rejected("Please analyze the file first");
        }
        if (selectedLanguages.isEmpty()) {
            return rejected("Please select at least one language");
        }

        String operationId = beginRun(ExtractionMode.SINGLE, OperationKind.EXTRACT_SINGLE);
        ExtractionRequest request = new ExtractionRequest(filePath.get(), outputPath.get(),
            new ArrayList<>(selectedLanguages), extractionOptions.get(), operationId);
        logger.info("Starting extraction {} for {} with {}", operationId, request.getFilePath(), extractionOptions.get());

        CompletableFuture<ExtractionResult> call;
        try {
            call = api.extractTracks(request);
        } catch (CapabilityUnavailableException e) {
            return failedToStart("Error extracting tracks: ", e);
        }

        CompletableFuture<ExtractionState> done = new CompletableFuture<>();
        call.whenComplete((result, failure) -> uiExecutor.execute(() -> {
            if (!isCurrent(operationId)) {
                logger.debug("Ignoring late result for superseded operation {}", operationId);
            } else if (failure != null) {
                failRun("Error extracting tracks: " + messageOf(failure));
            } else if (!result.isSuccess()) {
                failRun(result.getError() != null ? result.getError() : "Extraction failed");
            } else {
                extractionResult.set(result);
                progressValue.set(100);
                completeRun();
                logger.info("Extraction {} completed: {}", operationId, result);
            }
            done.complete(state.get());
        }));
        return done;
    }

    private CompletableFuture<ExtractionState> extractBatch() {
        if (inputPaths.isEmpty()) {
            return rejected("Please select input files or directory first");
        }
        if (isBlank(outputPath.get())) {
            return rejected("Please select an output directory");
        }
        if (selectedLanguages.isEmpty()) {
            return rejected("Please select at least one language");
        }

        String operationId = beginRun(ExtractionMode.BATCH, OperationKind.EXTRACT_BATCH);
        BatchExtractionRequest request = new BatchExtractionRequest(new ArrayList<>(inputPaths), outputPath.get(),
            new ArrayList<>(selectedLanguages), extractionOptions.get(), useOrgStructure, maxWorkers.get(), operationId);
        logger.info("Starting batch extraction {} of {} files with {} workers", operationId, inputPaths.size(), maxWorkers.get());

        CompletableFuture<BatchExtractionResult> call;
        try {
            call = api.batchExtract(request);
        } catch (CapabilityUnavailableException e) {
            return failedToStart("Error in batch extraction: ", e);
        }

        CompletableFuture<ExtractionState> done = new CompletableFuture<>();
        call.whenComplete((result, failure) -> uiExecutor.execute(() -> {
            if (!isCurrent(operationId)) {
                logger.debug("Ignoring late result for superseded batch {}", operationId);
            } else if (failure != null) {
                failRun("Error in batch extraction: " + messageOf(failure));
            } else if (!result.isSuccess()) {
                failRun(result.getError() != null ? result.getError() : "Batch extraction failed");
            } else {
                batchResult.set(result);
                batchTracker.complete();
                processedBatchFiles.set(batchTracker.getCompletedFiles());
                progressValue.set(100);
                completeRun();
                if (result.hasFailures()) {
                    logger.warn("Batch {} finished with {} failed files", operationId, result.getFailedFiles());
                } else {
                    logger.info("Batch {} completed: {}", operationId, result);
                }
            }
            done.complete(state.get());
        }));
        return done;
    }

    private String beginRun(ExtractionMode mode, OperationKind kind) {
        currentOperation = new Operation(null, kind);
        currentOperation.markRunning();
        currentMode = mode;
        cancelRequested = false;
        lastPayload = null;

        extracting.set(true);
        state.set(ExtractionState.RUNNING);
        error.set(null);
        extractionResult.set(null);
        batchResult.set(null);
        progressValue.set(0);
        progressText.set(mode == ExtractionMode.BATCH
            ? ProgressTextFormatter.INITIALIZING_BATCH
            : ProgressTextFormatter.INITIALIZING);
        fileProgressMap.clear();

        int total = mode == ExtractionMode.BATCH ? inputPaths.size() : 0;
        batchTracker.reset(total);
        totalBatchFiles.set(total);
        processedBatchFiles.set(0);

        String operationId = currentOperation.getId();
        subscription = api.subscribeProgress(operationId,
            event -> uiExecutor.execute(() -> onProgress(operationId, event)));
        return operationId;
    }

    private boolean isCurrent(String operationId) {
        return currentOperation != null && operationId.equals(currentOperation.getId());
    }

    private void completeRun() {
        endRun(true);
        state.set(ExtractionState.COMPLETED);
    }

    private void failRun(String message) {
        endRun(false);
        error.set(cancelRequested ? "Extraction cancelled" : message);
        state.set(ExtractionState.FAILED);
        logger.error("Extraction failed: {}", error.get());
    }

    private void endRun(boolean succeeded) {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (currentOperation != null) {
            currentOperation.markFinished(succeeded);
        }
        extracting.set(false);
    }

    private CompletableFuture<ExtractionState> failedToStart(String prefix, RuntimeException e) {
        failRun(prefix + e.getMessage());
        return CompletableFuture.completedFuture(state.get());
    }

    private CompletableFuture<ExtractionState> rejected(String message) {
        logger.warn("Extraction not started: {}", message);
        error.set(message);
        return CompletableFuture.completedFuture(state.get());
    }

    /**
     * Hard-cancel the running extraction by killing its worker
     * @return false when nothing is running
     */
    public boolean cancel() {
        if (!extracting.get() || currentOperation == null) {
            return false;
        }
        cancelRequested = true;
        return api.cancel(currentOperation.getId());
    }

    // ========== Progress reduction ==========

    private void onProgress(String operationId, ProgressEvent event) {
        if (!isCurrent(operationId) || !extracting.get()) {
            logger.debug("Ignoring progress for stale operation {}", operationId);
            return;
        }

        JsonObject payload = event.getPayload();
        if (payload != null && payload.equals(lastPayload)) {
            return;
        }
        lastPayload = payload;

        if (currentMode == ExtractionMode.BATCH) {
            reduceBatch(event);
        } else {
            reduceSingle(event);
        }
    }

    private void reduceSingle(ProgressEvent event) {
        int percentage = event.resolvePercentage();
        if (Math.abs(progressValue.get() - percentage) >= 1) {
            progressValue.set(percentage);
        }
        progressText.set(ProgressTextFormatter.singleFileText(event));
    }

    private void reduceBatch(ProgressEvent event) {
        progressText.set(ProgressTextFormatter.batchText(event));

        if (batchTracker.apply(event)) {
            Map<Integer, FileProgressEntry> entries = batchTracker.getEntries();
            fileProgressMap.keySet().retainAll(entries.keySet());
            fileProgressMap.putAll(entries);
            processedBatchFiles.set(batchTracker.getCompletedFiles());
            progressValue.set(batchTracker.overallProgress());
        }
    }

    // ========== Options ==========

    public ExtractionOptions toggleOption(ExtractionOption option) {
        ExtractionOptions updated = extractionOptions.get().toggle(option);
        extractionOptions.set(updated);
        logger.debug("Option {} toggled: {}", option, updated);
        return updated;
    }

    public void toggleLanguage(String language) {
        if (selectedLanguages.contains(language)) {
            selectedLanguages.remove(language);
        } else {
            selectedLanguages.add(language);
        }
    }

    public void setSelectedLanguages(List<String> languages) {
        selectedLanguages.setAll(languages);
    }

    /**
     * Store the batch worker count, clamped to [1, min(processing units, 16)]
     * @return the stored value
     */
    public int setMaxWorkers(int requested) {
        maxWorkers.set(resources.clampBatchWorkers(requested));
        return maxWorkers.get();
    }

    public void setUseOrgStructure(boolean useOrgStructure) {
        this.useOrgStructure = useOrgStructure;
    }

    // ========== Batch input ==========

    /**
     * Switch between single-file and batch mode.
     * Leaving batch mode discards the batch inputs and progress; entering it keeps everything.
     */
    public void toggleBatchMode() {
        if (!batchMode.get()) {
            batchMode.set(true);
            return;
        }
        inputPaths.clear();
        batchAnalyzed.set(null);
        fileProgressMap.clear();
        totalBatchFiles.set(0);
        processedBatchFiles.set(0);
        batchMode.set(false);
    }

    public void setInputPaths(List<String> paths) {
        inputPaths.setAll(paths);
        batchAnalyzed.set(null);
        error.set(null);
        totalBatchFiles.set(paths.size());
        processedBatchFiles.set(0);
    }

    /**
     * Scan a directory for media files and use them as batch input
     * @return the files found, empty on failure
     */
    public CompletableFuture<List<String>> loadInputDirectory(Path directory) {
        progressText.set(ProgressTextFormatter.SCANNING_DIRECTORY);

        CompletableFuture<MediaFileList> call;
        try {
            call = api.findMediaFiles(Collections.singletonList(directory));
        } catch (CapabilityUnavailableException e) {
            error.set("Error selecting directory: " + e.getMessage());
            return CompletableFuture.completedFuture(Collections.emptyList());
        }

        CompletableFuture<List<String>> done = new CompletableFuture<>();
        call.whenComplete((result, failure) -> uiExecutor.execute(() -> {
            if (failure != null) {
                error.set("Error selecting directory: " + messageOf(failure));
                done.complete(Collections.emptyList());
            } else if (!result.isSuccess()) {
                error.set("Error selecting directory: " + (result.getError() != null ? result.getError() : "No media files found"));
                done.complete(Collections.emptyList());
            } else {
                setInputPaths(result.getFiles());
                progressText.set(ProgressTextFormatter.foundFiles(result.getCount()));
                logger.info("Found {} media files in {}", result.getCount(), directory);
                done.complete(result.getFiles());
            }
        }));
        return done;
    }

    /**
     * Analyse the first batch input as a sample of the whole batch
     * @return the batch summary, or null when analysis failed
     */
    public CompletableFuture<AnalysisResult> analyzeBatch() {
        if (inputPaths.isEmpty()) {
            error.set("Please select input files or directory first");
            return CompletableFuture.completedFuture(null);
        }
        if (isBlank(outputPath.get())) {
            error.set("Please select an output directory");
            return CompletableFuture.completedFuture(null);
        }

        batchAnalyzing.set(true);
        error.set(null);
        progressText.set(ProgressTextFormatter.ANALYZING_BATCH);

        String sampleFile = inputPaths.get(0);
        int totalFiles = inputPaths.size();

        CompletableFuture<AnalysisResult> call;
        try {
            call = api.analyzeFile(Paths.get(sampleFile));
        } catch (CapabilityUnavailableException e) {
            error.set("Error analyzing batch: " + e.getMessage());
            batchAnalyzing.set(false);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<AnalysisResult> done = new CompletableFuture<>();
        call.whenComplete((result, failure) -> uiExecutor.execute(() -> {
            AnalysisResult summary = null;
            if (inputPaths.isEmpty() || !sampleFile.equals(inputPaths.get(0))) {
                logger.debug("Discarding batch analysis of {}, inputs changed", sampleFile);
            } else if (failure != null) {
                error.set("Error analyzing batch: " + messageOf(failure));
            } else if (!result.isSuccess()) {
                error.set(result.getError() != null ? result.getError() : "Batch analysis failed");
            } else {
                summary = result.asBatchSummary(sampleFile, totalFiles);
                batchAnalyzed.set(summary);
            }
            batchAnalyzing.set(false);
            done.complete(summary);
        }));
        return done;
    }

    // ========== Reset ==========

    /**
     * Clear results and progress, keeping languages and options
     */
    public void resetExtraction() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        currentOperation = null;
        lastPayload = null;
        extracting.set(false);
        state.set(ExtractionState.IDLE);
        extractionResult.set(null);
        batchResult.set(null);
        progressValue.set(0);
        progressText.set(ProgressTextFormatter.EXTRACTING_TRACKS);
        error.set(null);
        fileProgressMap.clear();
        batchTracker.reset(0);
        totalBatchFiles.set(0);
        processedBatchFiles.set(0);
    }

    /**
     * Also leave batch mode and drop the batch inputs; languages and options are kept
     */
    public void resetAll() {
        resetExtraction();
        batchMode.set(false);
        inputPaths.clear();
        batchAnalyzed.set(null);
    }

    // ========== Helpers ==========

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    static String messageOf(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    // ========== Properties ==========

    public StringProperty filePathProperty() { return filePath; }
    public StringProperty outputPathProperty() { return outputPath; }
    public ObjectProperty<AnalysisResult> analysisProperty() { return analysis; }
    public ObjectProperty<ExtractionState> stateProperty() { return state; }
    public BooleanProperty extractingProperty() { return extracting; }
    public ObjectProperty<ExtractionResult> extractionResultProperty() { return extractionResult; }
    public ObjectProperty<BatchExtractionResult> batchResultProperty() { return batchResult; }
    public StringProperty errorProperty() { return error; }
    public IntegerProperty progressValueProperty() { return progressValue; }
    public StringProperty progressTextProperty() { return progressText; }
    public ObservableMap<Integer, FileProgressEntry> getFileProgressMap() { return fileProgressMap; }
    public IntegerProperty totalBatchFilesProperty() { return totalBatchFiles; }
    public IntegerProperty processedBatchFilesProperty() { return processedBatchFiles; }
    public ObservableList<String> getSelectedLanguages() { return selectedLanguages; }
    public ObjectProperty<ExtractionOptions> extractionOptionsProperty() { return extractionOptions; }
    public BooleanProperty batchModeProperty() { return batchMode; }
    public ObservableList<String> getInputPaths() { return inputPaths; }
    public IntegerProperty maxWorkersProperty() { return maxWorkers; }
    public ObjectProperty<AnalysisResult> batchAnalyzedProperty() { return batchAnalyzed; }
    public BooleanProperty batchAnalyzingProperty() { return batchAnalyzing; }

    // ========== Values ==========

    public ExtractionState getState() { return state.get(); }
    public boolean isExtracting() { return extracting.get(); }
    public String getError() { return error.get(); }
    public int getProgressValue() { return progressValue.get(); }
    public String getProgressText() { return progressText.get(); }
    public int getTotalBatchFiles() { return totalBatchFiles.get(); }
    public int getProcessedBatchFiles() { return processedBatchFiles.get(); }
    public ExtractionOptions getExtractionOptions() { return extractionOptions.get(); }
    public boolean isBatchMode() { return batchMode.get(); }
    public int getMaxWorkers() { return maxWorkers.get(); }
    public Set<String> getActiveWorkers() { return batchTracker.activeWorkers(); }

    /**
     * Id of the running or last run operation, null before the first run
     */
    public String getCurrentOperationId() {
        return currentOperation != null ? currentOperation.getId() : null;
    }

    public void setFilePath(String path) { filePath.set(path); }
    public void setOutputPath(String path) { outputPath.set(path); }
    public void setAnalysis(AnalysisResult result) { analysis.set(result); }
    public void setBatchMode(boolean enabled) {
        if (enabled != batchMode.get()) {
            toggleBatchMode();
        }
    }
}
