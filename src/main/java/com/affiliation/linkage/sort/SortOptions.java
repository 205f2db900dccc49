package com.affiliation.linkage.sort;

import java.nio.file.Path;

/**
 * Configuration for the external sorter.
 *
 * @param memoryLimitBytes upper bound for rows held in memory across all in-flight chunks
 * @param threads          chunk-sorting threads, 0 means one per available processor
 * @param tempDir          directory for spill files, null for the system temp directory
 */
public record SortOptions(long memoryLimitBytes, int threads, Path tempDir) {

    static final long MIN_CHUNK_BYTES = 64 * 1024;

    public SortOptions {
        if (memoryLimitBytes < MIN_CHUNK_BYTES) {
            throw new IllegalArgumentException("memoryLimitBytes must be >= " + MIN_CHUNK_BYTES);
        }
        if (threads < 0) {
            throw new IllegalArgumentException("threads must be >= 0");
        }
    }

    /**
     * Default sort configuration: 512MB, one thread per processor, system temp directory.
     */
    public static SortOptions defaults() {
        return new SortOptions(512L << 20, 0, null);
    }

    public int effectiveThreads() {
        return threads == 0 ? Runtime.getRuntime().availableProcessors() : threads;
    }

    /**
     * Chunk size such that all sorting threads plus the chunk being filled fit the memory limit.
     */
    public long chunkBytes() {
        return Math.max(MIN_CHUNK_BYTES, memoryLimitBytes / (effectiveThreads() + 1));
    }
}
