package com.trackforge.controller;

import com.trackforge.model.AnalysisResult;
import com.trackforge.model.AppSettings;
import com.trackforge.model.BatchExtractionResult;
import com.trackforge.model.ExtractionOption;
import com.trackforge.model.ExtractionOptions;
import com.trackforge.model.ExtractionResult;
import com.trackforge.model.ExtractionState;
import com.trackforge.model.MediaFileList;
import com.trackforge.model.ProgressTextFormatter;
import com.trackforge.service.exception.WorkerExitException;
import com.trackforge.util.SystemResourceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.trackforge.controller.FakeMediaWorkerApi.json;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExtractionController")
class ExtractionControllerTest {

    private static final String ANALYSIS = "{\"success\":true,\"tracks\":[{\"id\":0,\"type\":\"audio\",\"language\":\"eng\"}],"
        + "\"audio_tracks\":1,\"languages\":{\"audio\":[\"eng\"],\"subtitle\":[],\"video\":[]}}";
    private static final List<String> BATCH_FILES = Arrays.asList("/media/a.mkv", "/media/b.mkv", "/media/c.mkv");

    private FakeMediaWorkerApi api;
    private ExtractionController controller;

    @BeforeEach
    void setUp() {
        api = new FakeMediaWorkerApi();
        controller = new ExtractionController(api, Runnable::run, new SystemResourceManager(8));
    }

    private void readySingleFile() {
        controller.setFilePath("/media/a.mkv");
        controller.setOutputPath("/out");
        controller.setAnalysis(AnalysisResult.fromJson(json(ANALYSIS)));
    }

    private void readyBatch() {
        controller.setBatchMode(true);
        controller.setOutputPath("/out");
        controller.setInputPaths(BATCH_FILES);
    }

    private static String single(String args) {
        return "{\"args\":" + args + ",\"kwargs\":{}}";
    }

    private static String batchFile(int index, int percentage, String status, boolean success) {
        return "{\"args\":[" + (index + 1) + ",3," + percentage + ",\"audio\"],\"kwargs\":{\"file_index\":" + index
            + ",\"file_name\":\"f" + index + ".mkv\",\"thread_id\":\"w" + index + "\",\"current\":" + (index + 1)
            + ",\"total\":3,\"status\":\"" + status + "\",\"success\":" + success + "}}";
    }

    @Nested
    @DisplayName("single file extraction")
    class SingleFileTests {

        @Test
        @DisplayName("progress drives value and text, success completes at 100")
        void progressShouldDriveStateUntilSuccess() {
            readySingleFile();

            CompletableFuture<ExtractionState> done = controller.extract();
            String id = controller.getCurrentOperationId();
            api.emit(id, single("[\"audio\",0,20,\"eng\"]"));

            assertTrue(controller.isExtracting());
            assertEquals(ExtractionState.RUNNING, controller.getState());
            assertEquals(20, controller.getProgressValue());
            assertEquals("Extracting audio track 0 [eng]", controller.getProgressText());
            assertFalse(done.isDone());

            api.emit(id, single("[\"audio\",0,100,\"eng\"]"));
            api.extractResponse.complete(ExtractionResult.fromJson(json("{\"success\":true,\"extracted_audio\":1}")));

            assertEquals(ExtractionState.COMPLETED, done.getNow(null));
            assertEquals(100, controller.getProgressValue());
            assertFalse(controller.isExtracting());
            assertNull(controller.getError());
            assertEquals(1, controller.extractionResultProperty().get().getExtractedAudio());
            assertFalse(api.channel.hasSubscriber(id));
        }

        @Test
        @DisplayName("request carries path, languages, options and the operation id")
        void requestShouldCarryInputs() {
            readySingleFile();
            controller.setSelectedLanguages(Arrays.asList("eng", "jpn"));
            controller.toggleOption(ExtractionOption.AUDIO_ONLY);

            controller.extract();

            assertEquals("/media/a.mkv", api.lastExtractRequest.getFilePath());
            assertEquals("/out", api.lastExtractRequest.getOutputDir());
            assertEquals(Arrays.asList("eng", "jpn"), api.lastExtractRequest.getLanguages());
            assertTrue(api.lastExtractRequest.isAudioOnly());
            assertEquals(controller.getCurrentOperationId(), api.lastExtractRequest.getOperationId());
        }

        @Test
        @DisplayName("keyed-only progress uses the generic text")
        void keyedOnlyProgressShouldUseGenericText() {
            readySingleFile();
            controller.extract();

            api.emit(controller.getCurrentOperationId(), "{\"kwargs\":{\"percentage\":35}}");

            assertEquals(35, controller.getProgressValue());
            assertEquals(ProgressTextFormatter.EXTRACTING_TRACKS, controller.getProgressText());
        }

        @Test
        @DisplayName("progress for another operation is ignored")
        void foreignProgressShouldBeIgnored() {
            readySingleFile();
            controller.extract();

            api.emit("some-other-operation", single("[\"audio\",0,80,\"eng\"]"));

            assertEquals(0, controller.getProgressValue());
            assertEquals(ProgressTextFormatter.INITIALIZING, controller.getProgressText());
        }

        @Test
        @DisplayName("worker exit failure is reported with its stderr")
        void workerExitShouldFail() {
            readySingleFile();
            CompletableFuture<ExtractionState> done = controller.extract();

            api.extractResponse.completeExceptionally(new WorkerExitException(1, "file not found"));

            assertEquals(ExtractionState.FAILED, done.getNow(null));
            assertEquals("Error extracting tracks: Worker process exited with code 1: file not found", controller.getError());
            assertFalse(controller.isExtracting());
        }

        @Test
        @DisplayName("success:false result fails with the worker's error")
        void unsuccessfulResultShouldFail() {
            readySingleFile();
            controller.extract();

            api.extractResponse.complete(ExtractionResult.fromJson(json("{\"success\":false,\"error\":\"No tracks matched\"}")));

            assertEquals(ExtractionState.FAILED, controller.getState());
            assertEquals("No tracks matched", controller.getError());
        }

        @Test
        @DisplayName("success:false without an error uses a generic message")
        void unsuccessfulResultWithoutErrorShouldUseGenericMessage() {
            readySingleFile();
            controller.extract();

            api.extractResponse.complete(ExtractionResult.fromJson(json("{\"success\":false}")));

            assertEquals("Extraction failed", controller.getError());
        }

        @Test
        @DisplayName("unavailable worker fails the run without a call")
        void unavailableWorkerShouldFail() {
            readySingleFile();
            api.unavailable = true;

            CompletableFuture<ExtractionState> done = controller.extract();

            assertEquals(ExtractionState.FAILED, done.getNow(null));
            assertTrue(controller.getError().startsWith("Error extracting tracks: "));
            assertFalse(controller.isExtracting());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("file is required")
        void fileShouldBeRequired() {
            controller.setOutputPath("/out");

            assertEquals(ExtractionState.IDLE, controller.extract().getNow(null));
            assertEquals("Please select a file first", controller.getError());
            assertNull(api.lastExtractRequest);
        }

        @Test
        @DisplayName("output directory is required")
        void outputShouldBeRequired() {
            controller.setFilePath("/media/a.mkv");

            controller.extract();

            assertEquals("Please select an output directory", controller.getError());
        }

        @Test
        @DisplayName("analysis is required")
        void analysisShouldBeRequired() {
            controller.setFilePath("/media/a.mkv");
            controller.setOutputPath("/out");

            controller.extract();

            assertEquals("Please analyze the file first", controller.getError());
        }

        @Test
        @DisplayName("at least one language is required")
        void languageShouldBeRequired() {
            readySingleFile();
            controller.toggleLanguage("eng");

            controller.extract();

            assertEquals("Please select at least one language", controller.getError());
            assertNull(api.lastExtractRequest);
        }

        @Test
        @DisplayName("batch needs inputs")
        void batchShouldNeedInputs() {
            controller.setBatchMode(true);
            controller.setOutputPath("/out");

            controller.extract();

            assertEquals("Please select input files or directory first", controller.getError());
            assertNull(api.lastBatchRequest);
        }
    }

    @Nested
    @DisplayName("batch extraction")
    class BatchTests {

        @Test
        @DisplayName("per-file progress is combined into overall progress")
        void perFileProgressShouldCombine() {
            readyBatch();
            CompletableFuture<ExtractionState> done = controller.extract();
            String id = controller.getCurrentOperationId();

            api.emit(id, batchFile(0, 100, "complete", true));
            api.emit(id, batchFile(1, 40, "processing", false));

            assertEquals(3, controller.getTotalBatchFiles());
            assertEquals(1, controller.getProcessedBatchFiles());
            assertEquals(47, controller.getProgressValue());
            assertEquals(Collections.singleton(1), controller.getFileProgressMap().keySet());
            assertEquals("f1.mkv", controller.getFileProgressMap().get(1).getFileName());
            assertEquals("Processing file 2/3", controller.getProgressText());
            assertEquals(Collections.singleton("w1"), controller.getActiveWorkers());

            api.batchResponse.complete(BatchExtractionResult.fromJson(json(
                "{\"total_files\":3,\"processed_files\":3,\"successful_files\":3,\"failed_files\":0,\"extracted_tracks\":6,\"failed_files_list\":[]}")));

            assertEquals(ExtractionState.COMPLETED, done.getNow(null));
            assertEquals(100, controller.getProgressValue());
            assertEquals(3, controller.getProcessedBatchFiles());
        }

        @Test
        @DisplayName("a repeated completion for a file is counted once")
        void repeatedCompletionShouldCountOnce() {
            readyBatch();
            controller.extract();
            String id = controller.getCurrentOperationId();

            api.emit(id, batchFile(0, 100, "complete", true));
            api.emit(id, batchFile(1, 40, "processing", false));
            api.emit(id, batchFile(0, 100, "complete", true));

            assertEquals(1, controller.getProcessedBatchFiles());
            assertEquals(47, controller.getProgressValue());
        }

        @Test
        @DisplayName("request carries batch settings")
        void requestShouldCarryBatchSettings() {
            readyBatch();
            controller.setUseOrgStructure(false);
            controller.setMaxWorkers(2);

            controller.extract();

            assertEquals(BATCH_FILES, api.lastBatchRequest.getInputPaths());
            assertEquals(2, api.lastBatchRequest.getMaxWorkers());
            assertFalse(api.lastBatchRequest.isUseOrgStructure());
            assertEquals(ProgressTextFormatter.INITIALIZING_BATCH, controller.getProgressText());
        }

        @Test
        @DisplayName("file failures inside a batch still complete the run")
        void partialFailureShouldComplete() {
            readyBatch();
            controller.extract();

            api.batchResponse.complete(BatchExtractionResult.fromJson(json(
                "{\"total_files\":3,\"processed_files\":3,\"successful_files\":2,\"failed_files\":1,"
                    + "\"extracted_tracks\":4,\"failed_files_list\":[[\"/media/c.mkv\",\"No matching tracks\"]]}")));

            assertEquals(ExtractionState.COMPLETED, controller.getState());
            assertTrue(controller.batchResultProperty().get().hasFailures());
        }

        @Test
        @DisplayName("a batch that could not run fails with its error")
        void batchErrorShouldFail() {
            readyBatch();
            controller.extract();

            api.batchResponse.complete(BatchExtractionResult.fromJson(json("{\"success\":false,\"error\":\"Output not writable\"}")));

            assertEquals(ExtractionState.FAILED, controller.getState());
            assertEquals("Output not writable", controller.getError());
        }

        @Test
        @DisplayName("call failure is prefixed for batch runs")
        void callFailureShouldBePrefixed() {
            readyBatch();
            controller.extract();

            api.batchResponse.completeExceptionally(new WorkerExitException(2, "Traceback"));

            assertEquals("Error in batch extraction: Worker process exited with code 2: Traceback", controller.getError());
        }
    }

    @Nested
    @DisplayName("worker count")
    class WorkerCountTests {

        @Test
        @DisplayName("defaults to four on an eight-core host")
        void defaultShouldBeFour() {
            assertEquals(4, controller.getMaxWorkers());
        }

        @Test
        @DisplayName("requests are clamped to the host")
        void requestsShouldBeClamped() {
            assertEquals(8, controller.setMaxWorkers(99));
            assertEquals(1, controller.setMaxWorkers(0));
            assertEquals(3, controller.setMaxWorkers(3));
            assertEquals(3, controller.getMaxWorkers());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancelTests {

        @Test
        @DisplayName("cancel() kills the running operation and reports cancellation")
        void cancelShouldReportCancellation() {
            readySingleFile();
            controller.extract();
            String id = controller.getCurrentOperationId();

            assertTrue(controller.cancel());
            api.extractResponse.completeExceptionally(new WorkerExitException(137, ""));

            assertEquals(Collections.singletonList(id), api.cancelled);
            assertEquals(ExtractionState.FAILED, controller.getState());
            assertEquals("Extraction cancelled", controller.getError());
        }

        @Test
        @DisplayName("cancel() with nothing running does nothing")
        void cancelWhenIdleShouldReturnFalse() {
            assertFalse(controller.cancel());
            assertTrue(api.cancelled.isEmpty());
        }
    }

    @Nested
    @DisplayName("batch input")
    class BatchInputTests {

        @Test
        @DisplayName("leaving batch mode clears batch inputs, entering keeps them")
        void toggleBatchModeShouldClearOnLeave() {
            controller.toggleBatchMode();
            controller.setInputPaths(BATCH_FILES);
            assertTrue(controller.isBatchMode());
            assertEquals(3, controller.getTotalBatchFiles());

            controller.toggleBatchMode();

            assertFalse(controller.isBatchMode());
            assertTrue(controller.getInputPaths().isEmpty());
            assertEquals(0, controller.getTotalBatchFiles());
            assertEquals(Collections.singletonList("eng"), controller.getSelectedLanguages());
        }

        @Test
        @DisplayName("directory scan fills the batch inputs")
        void directoryScanShouldFillInputs() {
            controller.setBatchMode(true);
            CompletableFuture<List<String>> found = controller.loadInputDirectory(Paths.get("/media"));
            assertEquals(ProgressTextFormatter.SCANNING_DIRECTORY, controller.getProgressText());

            api.findResponse.complete(MediaFileList.fromJson(json("{\"success\":true,\"files\":[\"/media/a.mkv\",\"/media/b.mkv\"]}")));

            assertEquals(Arrays.asList("/media/a.mkv", "/media/b.mkv"), found.getNow(null));
            assertEquals(2, controller.getInputPaths().size());
            assertEquals(2, controller.getTotalBatchFiles());
            assertEquals("Found 2 media files", controller.getProgressText());
        }

        @Test
        @DisplayName("failed directory scan reports an error and finds nothing")
        void failedScanShouldReportError() {
            CompletableFuture<List<String>> found = controller.loadInputDirectory(Paths.get("/media"));

            api.findResponse.complete(MediaFileList.fromJson(json("{\"success\":false}")));

            assertTrue(found.getNow(null).isEmpty());
            assertEquals("Error selecting directory: No media files found", controller.getError());
        }

        @Test
        @DisplayName("batch analysis samples the first file")
        void batchAnalysisShouldSampleFirstFile() {
            readyBatch();
            CompletableFuture<AnalysisResult> summary = controller.analyzeBatch();
            assertTrue(controller.batchAnalyzingProperty().get());

            api.analyzeResponse.complete(AnalysisResult.fromJson(json(ANALYSIS)));

            assertEquals(Paths.get("/media/a.mkv"), api.analyzedFiles.get(0));
            assertEquals("/media/a.mkv", summary.getNow(null).getSampleFile());
            assertEquals(3, controller.batchAnalyzedProperty().get().getTotalFiles());
            assertFalse(controller.batchAnalyzingProperty().get());
        }

        @Test
        @DisplayName("batch analysis failure is reported")
        void batchAnalysisFailureShouldBeReported() {
            readyBatch();
            CompletableFuture<AnalysisResult> summary = controller.analyzeBatch();

            api.analyzeResponse.completeExceptionally(new IllegalStateException("boom"));

            assertNull(summary.getNow(null));
            assertEquals("Error analyzing batch: boom", controller.getError());
        }
    }

    @Nested
    @DisplayName("settings and reset")
    class SettingsTests {

        @Test
        @DisplayName("saved settings seed the session")
        void settingsShouldSeedSession() {
            AppSettings settings = new AppSettings();
            settings.setDefaultLanguages(Collections.singletonList("jpn"));
            settings.setMaxWorkers(32);
            settings.setOutputDirectory("/saved");
            settings.setExtractionOptions(ExtractionOptions.defaults().toggle(ExtractionOption.VIDEO_ONLY));

            controller.applySettings(settings);

            assertEquals(Collections.singletonList("jpn"), controller.getSelectedLanguages());
            assertEquals(8, controller.getMaxWorkers());
            assertEquals("/saved", controller.outputPathProperty().get());
            assertTrue(controller.getExtractionOptions().isVideoOnly());
        }

        @Test
        @DisplayName("resetExtraction() clears the run but keeps languages and options")
        void resetShouldKeepPreferences() {
            readySingleFile();
            controller.toggleOption(ExtractionOption.SUBTITLE_ONLY);
            controller.extract();
            api.extractResponse.completeExceptionally(new WorkerExitException(1, "boom"));

            controller.resetExtraction();

            assertEquals(ExtractionState.IDLE, controller.getState());
            assertNull(controller.getError());
            assertEquals(0, controller.getProgressValue());
            assertNull(controller.getCurrentOperationId());
            assertTrue(controller.getExtractionOptions().isSubtitleOnly());
            assertEquals(Collections.singletonList("eng"), controller.getSelectedLanguages());
        }

        @Test
        @DisplayName("resetAll() also leaves batch mode")
        void resetAllShouldLeaveBatchMode() {
            readyBatch();

            controller.resetAll();

            assertFalse(controller.isBatchMode());
            assertTrue(controller.getInputPaths().isEmpty());
        }
    }

    @Nested
    @DisplayName("results of superseded runs")
    class SupersededRunTests {

        @Test
        @DisplayName("a success arriving after reset leaves the controller idle")
        void lateSuccessAfterResetShouldBeIgnored() {
            readySingleFile();
            CompletableFuture<ExtractionState> done = controller.extract();

            controller.resetExtraction();
            api.extractResponse.complete(ExtractionResult.fromJson(json("{\"success\":true,\"extracted_audio\":1}")));

            assertTrue(done.isDone());
            assertEquals(ExtractionState.IDLE, controller.getState());
            assertEquals(0, controller.getProgressValue());
            assertFalse(controller.isExtracting());
            assertNull(controller.extractionResultProperty().get());
        }

        @Test
        @DisplayName("a failure arriving after reset does not set an error")
        void lateFailureAfterResetShouldBeIgnored() {
            readySingleFile();
            controller.extract();

            controller.resetExtraction();
            api.extractResponse.completeExceptionally(new WorkerExitException(1, "boom"));

            assertEquals(ExtractionState.IDLE, controller.getState());
            assertNull(controller.getError());
        }

        @Test
        @DisplayName("an earlier run finishing does not end or unsubscribe the newer run")
        void earlierRunShouldNotTouchNewerRun() {
            readySingleFile();
            controller.extract();
            CompletableFuture<ExtractionResult> first = api.extractResponse;
            controller.resetExtraction();

            api.extractResponse = new CompletableFuture<>();
            controller.extract();
            String newer = controller.getCurrentOperationId();
            first.complete(ExtractionResult.fromJson(json("{\"success\":true}")));

            assertEquals(ExtractionState.RUNNING, controller.getState());
            assertTrue(controller.isExtracting());
            assertTrue(api.channel.hasSubscriber(newer));

            api.emit(newer, single("[\"audio\",0,30,\"eng\"]"));
            assertEquals(30, controller.getProgressValue());
        }

        @Test
        @DisplayName("a batch result arriving after reset leaves the counters at zero")
        void lateBatchResultAfterResetShouldBeIgnored() {
            readyBatch();
            controller.extract();

            controller.resetExtraction();
            api.batchResponse.complete(BatchExtractionResult.fromJson(json(
                "{\"total_files\":3,\"processed_files\":3,\"successful_files\":3,\"failed_files\":0,\"failed_files_list\":[]}")));

            assertEquals(ExtractionState.IDLE, controller.getState());
            assertEquals(0, controller.getProcessedBatchFiles());
            assertEquals(0, controller.getProgressValue());
            assertNull(controller.batchResultProperty().get());
        }

        @Test
        @DisplayName("a sample analysis arriving after the inputs changed is discarded")
        void lateBatchAnalysisAfterInputChangeShouldBeDiscarded() {
            readyBatch();
            CompletableFuture<AnalysisResult> summary = controller.analyzeBatch();

            controller.setInputPaths(Collections.singletonList("/media/other.mkv"));
            api.analyzeResponse.complete(AnalysisResult.fromJson(json(ANALYSIS)));

            assertNull(summary.getNow(null));
            assertNull(controller.batchAnalyzedProperty().get());
            assertFalse(controller.batchAnalyzingProperty().get());
        }
    }
}
