package com.trackforge.service;

import com.trackforge.model.Operation;
import com.trackforge.service.exception.WorkerStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Spawns worker processes and keeps a registry of the live ones by operation id.
 * <p>
 * A process is deregistered as soon as it exits, whatever its exit code.
 * Start failures never throw; they surface through {@link WorkerProcess#exitFuture()}.
 */
public class ProcessSupervisor {
    private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final long TERMINATION_TIMEOUT_MS = 5000;

    private final Map<String, WorkerProcess> processes = new ConcurrentHashMap<>();
    private final Map<String, String> environment;

    public ProcessSupervisor() {
        this(Collections.emptyMap());
    }

    /**
     * @param environment extra variables added to every worker's environment
     */
    public ProcessSupervisor(Map<String, String> environment) {
        this.environment = new HashMap<>(environment);
    }

    /**
     * Start {@code [executable, script, args...]} and register it.
     * @param operationId id to register under; a random one is generated when null
     */
    public synchronized WorkerProcess spawn(String executable, Path script, List<String> args, String operationId) {
        String id = operationId != null ? operationId : Operation.newId();

        WorkerProcess existing = processes.get(id);
        if (existing != null && existing.isAlive()) {
            logger.warn("Refusing to spawn worker for {}: a live worker already uses this id", id);
            return WorkerProcess.failed(id, new WorkerStartException("operation id already in use: " + id));
        }

        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add(script.toString());
        command.addAll(args);

        ProcessBuilder pb = new ProcessBuilder(command);

        Path workingDir = script.toAbsolutePath().getParent();
        if (workingDir != null && Files.isDirectory(workingDir)) {
            pb.directory(workingDir.toFile());
        }

        pb.environment().put("PYTHONUNBUFFERED", "1");
        pb.environment().putAll(environment);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            logger.error("Failed to start worker for operation {}: {}", id, e.getMessage());
            return WorkerProcess.failed(id, new WorkerStartException(e.getMessage(), e));
        }

        CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
        WorkerProcess handle = new WorkerProcess(id, process, exitFuture);
        processes.put(id, handle);
        logger.info("Spawned worker pid {} for operation {}", process.pid(), id);
        logger.debug("  Command: {}", command);

        // Registered before attaching, so a process that has already exited is still removed
        process.onExit().whenComplete((exited, error) -> {
            processes.remove(id, handle);
            if (error != null) {
                exitFuture.completeExceptionally(error);
                return;
            }
            int exitCode = exited.exitValue();
            logger.info("Worker for operation {} exited with code {}", id, exitCode);
            exitFuture.complete(exitCode);
        });

        return handle;
    }

    /**
     * Force-kill the worker registered under the id
     * @return false when no such worker is registered
     */
    public boolean terminate(String operationId) {
        if (operationId == null) {
            return false;
        }
        WorkerProcess handle = processes.remove(operationId);
        if (handle == null) {
            logger.debug("No running worker for operation {}", operationId);
            return false;
        }
        logger.info("Terminating worker for operation {}", operationId);
        kill(handle);
        return true;
    }

    /**
     * Kill every registered worker and wait briefly for them to exit
     * @return number of workers that were registered
     */
    public int terminateAll() {
        List<WorkerProcess> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(processes.values());
            processes.clear();
        }

        if (snapshot.isEmpty()) {
            return 0;
        }

        logger.info("Terminating {} worker processes", snapshot.size());
        for (WorkerProcess handle : snapshot) {
            kill(handle);
        }

        long deadline = System.currentTimeMillis() + TERMINATION_TIMEOUT_MS;
        for (WorkerProcess handle : snapshot) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                if (!handle.getProcess().waitFor(remaining, TimeUnit.MILLISECONDS)) {
                    logger.warn("Worker {} did not exit within timeout", handle);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for workers to exit");
                break;
            }
        }

        return snapshot.size();
    }

    private void kill(WorkerProcess handle) {
        Process process = handle.getProcess();
        if (process == null) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    public int activeCount() {
        return processes.size();
    }

    public boolean isRegistered(String operationId) {
        return operationId != null && processes.containsKey(operationId);
    }
}
