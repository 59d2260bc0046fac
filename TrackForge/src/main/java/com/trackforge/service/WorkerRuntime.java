package com.trackforge.service;

import java.nio.file.Path;

/**
 * Resolved interpreter and entry script used to launch workers
 */
public class WorkerRuntime {
    private final String executable;
    private final Path script;

    public WorkerRuntime(String executable, Path script) {
        this.executable = executable;
        this.script = script;
    }

    public String getExecutable() {
        return executable;
    }

    public Path getScript() {
        return script;
    }

    @Override
    public String toString() {
        return executable + " " + script;
    }
}
