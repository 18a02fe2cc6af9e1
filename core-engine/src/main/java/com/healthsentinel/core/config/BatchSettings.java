package com.healthsentinel.core.config;

import java.util.List;

/**
 * Batch fan-out parameters, bound from the {@code batch:} section.
 *
 * @since 1.0.0
 */
public class BatchSettings {

    private int chunkSize = 64;
    /** 0 means one worker per available processor. */
    private int workerThreads = 0;
    private int retries = 1;

    /**
     * @return the effective pool size
     */
    public int resolveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    void validate(List<String> errors) {
        if (chunkSize < 1) {
            errors.add("batch.chunkSize must be >= 1");
        }
        if (workerThreads < 0) {
            errors.add("batch.workerThreads must be >= 0");
        }
        if (retries < 0) {
            errors.add("batch.retries must be >= 0");
        }
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    @Override
    public String toString() {
        return "BatchSettings{chunkSize=" + chunkSize + ", workers=" + workerThreads + ", retries=" + retries + '}';
    }
}
