package com.trackforge.service;

import com.trackforge.service.exception.CapabilityUnavailableException;
import com.trackforge.util.PathManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Finds the Python interpreter and the worker entry script.
 * <p>
 * Interpreter: {@code TRACKFORGE_PYTHON} or {@code PYTHON_PATH}, then a bundled interpreter in the
 * worker directory, then {@code python3} ({@code python} on Windows).
 * Script: {@code bridge.py} in the directory named by {@code trackforge.worker.dir}, then
 * {@code backend/bridge.py} relative to the working directory.
 */
public class WorkerLocator {
    private static final Logger logger = LoggerFactory.getLogger(WorkerLocator.class);

    public static final String SCRIPT_NAME = "bridge.py";
    public static final String WORKER_DIR_PROPERTY = "trackforge.worker.dir";
    public static final String PYTHON_ENV = "TRACKFORGE_PYTHON";
    public static final String LEGACY_PYTHON_ENV = "PYTHON_PATH";

    private final Map<String, String> env;
    private final String workerDir;
    private final Path devDir;
    private final WorkerRuntime fixedRuntime;

    public WorkerLocator() {
        this(System.getenv(), System.getProperty(WORKER_DIR_PROPERTY), Paths.get("backend"));
    }

    public WorkerLocator(Map<String, String> env, String workerDir, Path devDir) {
        this.env = env != null ? env : Collections.emptyMap();
        this.workerDir = workerDir;
        this.devDir = devDir;
        this.fixedRuntime = null;
    }

    private WorkerLocator(WorkerRuntime fixedRuntime) {
        this.env = Collections.emptyMap();
        this.workerDir = null;
        this.devDir = null;
        this.fixedRuntime = fixedRuntime;
    }

    /**
     * Locator that always answers with the given interpreter and script, still checking the script exists
     */
    public static WorkerLocator fixed(String executable, Path script) {
        return new WorkerLocator(new WorkerRuntime(executable, script));
    }

    /**
     * @throws CapabilityUnavailableException when the interpreter or script cannot be found
     */
    public WorkerRuntime resolve() {
        if (fixedRuntime != null) {
            checkExecutable(fixedRuntime.getExecutable());
            if (!Files.isRegularFile(fixedRuntime.getScript())) {
                throw new CapabilityUnavailableException("Worker script not found: " + fixedRuntime.getScript());
            }
            return fixedRuntime;
        }

        Path script = resolveScript();
        String executable = resolveExecutable();
        checkExecutable(executable);
        logger.debug("Worker runtime: {} {}", executable, script);
        return new WorkerRuntime(executable, script);
    }

    private Path resolveScript() {
        List<Path> checked = new ArrayList<>();

        if (workerDir != null && !workerDir.isEmpty()) {
            Path scriptPath = Paths.get(workerDir, SCRIPT_NAME);
            if (Files.isRegularFile(scriptPath)) {
                return scriptPath;
            }
            checked.add(scriptPath);
        }

        if (devDir != null) {
            Path devScriptPath = devDir.resolve(SCRIPT_NAME);
            if (Files.isRegularFile(devScriptPath)) {
                return devScriptPath;
            }
            checked.add(devScriptPath);
        }

        StringBuilder message = new StringBuilder("Worker script (" + SCRIPT_NAME + ") not found. Checked:");
        for (Path path : checked) {
            message.append("\n  - ").append(path);
        }
        throw new CapabilityUnavailableException(message.toString());
    }

    private String resolveExecutable() {
        String override = env.get(PYTHON_ENV);
        if (override == null || override.isEmpty()) {
            override = env.get(LEGACY_PYTHON_ENV);
        }
        if (override != null && !override.isEmpty()) {
            return override;
        }

        if (workerDir != null && !workerDir.isEmpty()) {
            Path bundled = Paths.get(workerDir, PathManager.isWindows() ? "python.exe" : "python");
            if (Files.isRegularFile(bundled)) {
                return bundled.toString();
            }
        }

        return PathManager.isWindows() ? "python" : "python3";
    }

    /**
     * Bare command names are looked up on PATH at spawn time; explicit paths must exist now
     */
    private static void checkExecutable(String executable) {
        if (executable == null || executable.isEmpty()) {
            throw new CapabilityUnavailableException("No worker interpreter configured");
        }
        Path path = Paths.get(executable);
        if (path.getParent() != null && !Files.exists(path)) {
            throw new CapabilityUnavailableException("Worker interpreter not found: " + executable);
        }
    }
}
