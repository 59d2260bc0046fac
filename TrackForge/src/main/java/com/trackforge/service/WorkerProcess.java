package com.trackforge.service;

import com.trackforge.service.exception.WorkerStartException;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to one spawned worker, registered under its operation id until it exits
 */
public class WorkerProcess {
    private final String operationId;
    private final Process process;
    private final CompletableFuture<Integer> exitFuture;

    WorkerProcess(String operationId, Process process, CompletableFuture<Integer> exitFuture) {
        this.operationId = operationId;
        this.process = process;
        this.exitFuture = exitFuture;
    }

    static WorkerProcess failed(String operationId, WorkerStartException cause) {
        CompletableFuture<Integer> exit = new CompletableFuture<>();
        exit.completeExceptionally(cause);
        return new WorkerProcess(operationId, null, exit);
    }

    public String getOperationId() {
        return operationId;
    }

    /**
     * Whether the OS process was launched at all
     */
    public boolean isStarted() {
        return process != null;
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public long getPid() {
        return process != null ? process.pid() : -1;
    }

    /**
     * Completes with the exit code, or exceptionally with {@link WorkerStartException}
     * when the process never started
     */
    public CompletableFuture<Integer> exitFuture() {
        return exitFuture;
    }

    public InputStream getStdout() {
        return process != null ? process.getInputStream() : InputStream.nullInputStream();
    }

    public InputStream getStderr() {
        return process != null ? process.getErrorStream() : InputStream.nullInputStream();
    }

    Process getProcess() {
        return process;
    }

    @Override
    public String toString() {
        return "WorkerProcess[" + operationId + ", pid=" + getPid() + "]";
    }
}
