package com.trackforge.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SystemResourceManager - Detects processing units and provides batch worker limits
 */
public class SystemResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(SystemResourceManager.class);

    /** Hard ceiling on parallel batch workers regardless of hardware */
    public static final int MAX_BATCH_WORKERS = 16;
    /** Ceiling for the default worker count of a new session */
    public static final int DEFAULT_BATCH_WORKERS = 4;

    private final int logicalCpuCount;

    private static SystemResourceManager instance;

    /**
     * Create a manager for a host reporting the given number of processing units
     */
    public SystemResourceManager(int logicalCpuCount) {
        this.logicalCpuCount = Math.max(1, logicalCpuCount);
    }

    public static synchronized SystemResourceManager getInstance() {
        if (instance == null) {
            instance = new SystemResourceManager(Runtime.getRuntime().availableProcessors());
            logger.info("CPU Cores (Logical): {}", instance.logicalCpuCount);
        }
        return instance;
    }

    /**
     * Get logical CPU core count (includes hyperthreading)
     */
    public int getLogicalCpuCount() {
        return logicalCpuCount;
    }

    /**
     * Upper bound for the batch worker setting: min(cpus, 16)
     */
    public int getMaxBatchWorkers() {
        return Math.min(logicalCpuCount, MAX_BATCH_WORKERS);
    }

    /**
     * Initial batch worker count: min(cpus, 4)
     */
    public int getDefaultBatchWorkers() {
        return Math.min(logicalCpuCount, DEFAULT_BATCH_WORKERS);
    }

    /**
     * Clamp a requested worker count into [1, getMaxBatchWorkers()]
     */
    public int clampBatchWorkers(int requested) {
        int clamped = Math.max(1, Math.min(requested, getMaxBatchWorkers()));
        if (clamped != requested) {
            logger.debug("Requested {} batch workers, using {}", requested, clamped);
        }
        return clamped;
    }
}
