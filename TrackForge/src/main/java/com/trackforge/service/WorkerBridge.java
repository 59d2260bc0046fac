package com.trackforge.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.trackforge.model.Operation;
import com.trackforge.service.exception.WorkerExitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bridge for calling worker functions: one worker process per call, JSON arguments on the
 * command line, progress and result on stdout.
 * <p>
 * The returned future completes only after stdout and stderr are fully read and the process
 * has exited, so every progress notification of a call is published before its result.
 */
public class WorkerBridge {
    private static final Logger logger = LoggerFactory.getLogger(WorkerBridge.class);
    private static final Gson gson = new Gson();

    private final ProcessSupervisor supervisor;
    private final ProgressChannel progressChannel;
    private final WorkerLocator locator;
    private final ExecutorService ioExecutor;

    public WorkerBridge(ProcessSupervisor supervisor, ProgressChannel progressChannel, WorkerLocator locator) {
        this.supervisor = supervisor;
        this.progressChannel = progressChannel;
        this.locator = locator;

        // Two reader threads per running call
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "WorkerBridge-IO");
            t.setDaemon(true);
            return t;
        });

        logger.info("WorkerBridge initialized");
    }

    /**
     * Check that a worker can be launched at all
     * @throws com.trackforge.service.exception.CapabilityUnavailableException if not
     */
    public WorkerRuntime checkAvailable() {
        return locator.resolve();
    }

    /**
     * Invoke a worker function.
     * @param functionName worker function to run
     * @param args         object (keyword arguments) or array (positional); anything else is wrapped in an array
     * @param operationId  id for progress routing and cancellation; generated when null
     * @return future of the parsed result; failures arrive as {@link com.trackforge.service.exception.WorkerException}s
     * @throws com.trackforge.service.exception.CapabilityUnavailableException when no worker can be launched
     */
    public CompletableFuture<JsonElement> call(String functionName, JsonElement args, String operationId) {
        WorkerRuntime runtime = locator.resolve();

        String id = operationId != null ? operationId : Operation.newId();
        String argsJson = gson.toJson(normalizeArgs(args));

        logger.debug("Calling {} for operation {} with {}", functionName, id, argsJson);
        List<String> argv = Arrays.asList(functionName, argsJson, id);
        WorkerProcess worker = supervisor.spawn(runtime.getExecutable(), runtime.getScript(), argv, id);

        if (!worker.isStarted()) {
            CompletableFuture<JsonElement> failed = new CompletableFuture<>();
            worker.exitFuture().whenComplete((code, error) -> failed.completeExceptionally(unwrap(error)));
            return failed;
        }

        WorkerOutputParser parser = new WorkerOutputParser(id, payload -> progressChannel.publish(id, payload));
        StringBuilder stderr = new StringBuilder();

        CompletableFuture<Void> stdoutDone = CompletableFuture.runAsync(
            () -> readLines(worker.getStdout(), parser::acceptLine, id, "stdout"), ioExecutor);
        CompletableFuture<Void> stderrDone = CompletableFuture.runAsync(
            () -> readLines(worker.getStderr(), line -> {
                logger.debug("[{}] stderr: {}", id, line);
                synchronized (stderr) {
                    if (stderr.length() > 0) {
                        stderr.append('\n');
                    }
                    stderr.append(line);
                }
            }, id, "stderr"), ioExecutor);

        CompletableFuture<JsonElement> result = new CompletableFuture<>();
        CompletableFuture.allOf(stdoutDone, stderrDone, worker.exitFuture()).whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                logger.error("Worker call {} ({}) failed", functionName, id, cause);
                result.completeExceptionally(cause);
                return;
            }

            int exitCode = worker.exitFuture().join();
            if (exitCode != 0) {
                String errorOutput;
                synchronized (stderr) {
                    errorOutput = stderr.toString();
                }
                WorkerExitException failure = new WorkerExitException(exitCode, errorOutput);
                logger.error("Worker call {} ({}) failed: {}", functionName, id, failure.getMessage());
                result.completeExceptionally(failure);
                return;
            }

            try {
                JsonElement value = parser.parseResult();
                logger.debug("Worker call {} ({}) completed, {} progress updates", functionName, id, parser.getProgressCount());
                result.complete(value);
            } catch (IOException e) {
                logger.error("Worker call {} ({}) returned unparsable output: {}", functionName, id, parser.getBody());
                result.completeExceptionally(e);
            }
        });

        return result;
    }

    /**
     * Blocking variant of {@link #call}, for command line use
     */
    public JsonElement callAndWait(String functionName, JsonElement args, String operationId) throws IOException {
        try {
            return call(functionName, args, operationId).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            supervisor.terminate(operationId);
            throw new IOException("Interrupted while waiting for " + functionName, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause != null ? cause.getMessage() : e.getMessage(), cause);
        }
    }

    static JsonElement normalizeArgs(JsonElement args) {
        if (args != null && (args.isJsonObject() || args.isJsonArray())) {
            return args;
        }
        JsonArray wrapped = new JsonArray();
        wrapped.add(args);
        return wrapped;
    }

    private static void readLines(InputStream stream, Consumer<String> sink, String operationId, String streamName) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sink.accept(line);
            }
        } catch (IOException e) {
            // Keep what was read; the exit code decides the outcome
            logger.warn("[{}] Error reading worker {}: {}", operationId, streamName, e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public ProcessSupervisor getSupervisor() {
        return supervisor;
    }

    public ProgressChannel getProgressChannel() {
        return progressChannel;
    }

    /**
     * Kill all workers and stop the reader threads
     */
    public void shutdown() {
        int terminated = supervisor.terminateAll();
        logger.info("Shutting down WorkerBridge, terminated {} workers", terminated);

        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
