package com.trackforge.model;

import com.google.gson.JsonParser;
import com.trackforge.service.ProgressEventDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchProgressTracker")
class BatchProgressTrackerTest {

    private BatchProgressTracker tracker;

    private static ProgressEvent event(String json) {
        return ProgressEventDecoder.decode("batch-1", JsonParser.parseString(json).getAsJsonObject());
    }

    private static ProgressEvent fileCompleted(int index, String name) {
        return event("{\"args\":[" + (index + 1) + ",3,100,\"audio\"],\"kwargs\":{\"file_index\":" + index
            + ",\"file_name\":\"" + name + "\",\"thread_id\":\"w" + index + "\",\"current\":" + (index + 1)
            + ",\"total\":3,\"status\":\"complete\",\"success\":true}}");
    }

    private static ProgressEvent fileProgress(int index, String name, int percentage) {
        return event("{\"args\":[" + (index + 1) + ",3," + percentage + ",\"audio\"],\"kwargs\":{\"file_index\":" + index
            + ",\"file_name\":\"" + name + "\",\"thread_id\":\"w" + index + "\",\"current\":" + (index + 1)
            + ",\"total\":3,\"status\":\"processing\"}}");
    }

    @BeforeEach
    void setUp() {
        tracker = new BatchProgressTracker();
        tracker.reset(3);
    }

    @Nested
    @DisplayName("overall progress")
    class OverallProgressTests {

        @Test
        @DisplayName("one file complete and one at 40% of three gives 47")
        void oneCompleteOneAt40ShouldGive47() {
            tracker.apply(fileCompleted(0, "a.mkv"));
            tracker.apply(fileProgress(1, "b.mkv", 40));

            assertEquals(47, tracker.overallProgress());
            assertEquals(1, tracker.getCompletedFiles());
            assertEquals(Collections.singleton(1), tracker.getEntries().keySet());
        }

        @Test
        @DisplayName("arrival order does not change the result")
        void orderShouldNotMatter() {
            tracker.apply(fileProgress(1, "b.mkv", 40));
            tracker.apply(fileCompleted(0, "a.mkv"));

            assertEquals(47, tracker.overallProgress());
        }

        @Test
        @DisplayName("a file's progress replaces its previous entry")
        void laterProgressShouldReplaceEntry() {
            tracker.apply(fileProgress(2, "c.mkv", 10));
            tracker.apply(fileProgress(2, "c.mkv", 60));

            assertEquals(1, tracker.getEntries().size());
            assertEquals(60, tracker.getEntries().get(2).getPercentage());
        }

        @Test
        @DisplayName("empty batch reports 0")
        void emptyBatchShouldReportZero() {
            tracker.reset(0);
            assertEquals(0, tracker.overallProgress());
        }

        @Test
        @DisplayName("complete() counts every file as done and keeps entries")
        void completeShouldFinishBatch() {
            tracker.apply(fileProgress(1, "b.mkv", 40));
            tracker.complete();

            assertEquals(3, tracker.getCompletedFiles());
            assertEquals(100, tracker.overallProgress());
            assertEquals(1, tracker.getEntries().size());
        }
    }

    @Nested
    @DisplayName("completion counting")
    class CompletionTests {

        @Test
        @DisplayName("duplicate completion of the same file is counted once")
        void duplicateCompletionShouldCountOnce() {
            tracker.apply(fileCompleted(0, "a.mkv"));
            tracker.apply(fileCompleted(0, "a.mkv"));

            assertEquals(1, tracker.getCompletedFiles());
        }

        @Test
        @DisplayName("unsuccessful completion is not counted")
        void failedCompletionShouldNotCount() {
            tracker.apply(event("{\"kwargs\":{\"file_index\":0,\"current\":1,\"total\":3,\"status\":\"complete\",\"success\":false}}"));

            assertEquals(0, tracker.getCompletedFiles());
        }

        @Test
        @DisplayName("completion without counters is not counted")
        void completionWithoutCountersShouldNotCount() {
            tracker.apply(event("{\"kwargs\":{\"file_index\":0,\"status\":\"complete\",\"success\":true}}"));
            tracker.apply(event("{\"kwargs\":{\"file_index\":1,\"current\":0,\"total\":0,\"status\":\"complete\",\"success\":true}}"));

            assertEquals(0, tracker.getCompletedFiles());
        }

        @Test
        @DisplayName("success must be a real boolean")
        void stringSuccessShouldNotCount() {
            tracker.apply(event("{\"kwargs\":{\"file_index\":0,\"current\":1,\"total\":3,\"status\":\"complete\",\"success\":\"true\"}}"));

            assertEquals(0, tracker.getCompletedFiles());
        }
    }

    @Nested
    @DisplayName("file entries")
    class EntryTests {

        @Test
        @DisplayName("missing name and worker fall back to defaults")
        void missingFieldsShouldUseDefaults() {
            tracker.apply(event("{\"kwargs\":{\"file_index\":2,\"percentage\":30}}"));

            FileProgressEntry entry = tracker.getEntries().get(2);
            assertEquals("File 2", entry.getFileName());
            assertEquals(BatchProgressTracker.UNKNOWN_WORKER, entry.getWorkerId());
            assertEquals(30, entry.getPercentage());
            assertEquals(ProgressTextFormatter.PROCESSING_FILES, entry.getStatusText());
        }

        @Test
        @DisplayName("status text prefers the worker's description")
        void statusShouldPreferDescription() {
            tracker.apply(event("{\"kwargs\":{\"file_index\":0,\"percentage\":30,\"description\":\"Extracting audio\",\"current\":1,\"total\":3}}"));
            tracker.apply(event("{\"kwargs\":{\"file_index\":1,\"percentage\":30,\"current\":2,\"total\":3}}"));

            assertEquals("Extracting audio", tracker.getEntries().get(0).getStatusText());
            assertEquals("Processing file 2/3", tracker.getEntries().get(1).getStatusText());
        }

        @Test
        @DisplayName("camelCase keys are accepted")
        void camelCaseKeysShouldBeAccepted() {
            tracker.apply(event("{\"kwargs\":{\"fileIndex\":1,\"fileName\":\"b.mkv\",\"workerId\":\"w7\",\"percentage\":12}}"));

            FileProgressEntry entry = tracker.getEntries().get(1);
            assertEquals("b.mkv", entry.getFileName());
            assertEquals("w7", entry.getWorkerId());
        }

        @Test
        @DisplayName("active workers lists distinct ids of files in flight")
        void activeWorkersShouldBeDistinct() {
            tracker.apply(event("{\"kwargs\":{\"file_index\":0,\"worker_id\":\"w1\",\"percentage\":10}}"));
            tracker.apply(event("{\"kwargs\":{\"file_index\":1,\"worker_id\":\"w2\",\"percentage\":10}}"));
            tracker.apply(event("{\"kwargs\":{\"file_index\":2,\"worker_id\":\"w1\",\"percentage\":10}}"));

            assertEquals(new LinkedHashSet<>(Arrays.asList("w1", "w2")), tracker.activeWorkers());
        }

        @Test
        @DisplayName("events without a keyed part change nothing")
        void positionalOnlyShouldBeIgnored() {
            assertFalse(tracker.apply(event("{\"args\":[\"audio\",0,20]}")));
            assertTrue(tracker.getEntries().isEmpty());
        }

        @Test
        @DisplayName("entries are read-only")
        void entriesShouldBeReadOnly() {
            assertThrows(UnsupportedOperationException.class, () -> tracker.getEntries().clear());
        }
    }
}
