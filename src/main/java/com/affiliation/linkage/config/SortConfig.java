package com.affiliation.linkage.config;

import com.affiliation.linkage.sort.SortOptions;

import java.nio.file.Path;

/**
 * Sort section of the pipeline configuration.
 *
 * @param memoryLimit memory bound as a size string, e.g. {@code 512MB}
 * @param threads     chunk-sorting threads, 0 for one per processor
 * @param tempDir     spill directory, empty for the system temp directory
 */
public record SortConfig(String memoryLimit, Integer threads, String tempDir) {

    public static SortConfig defaults() {
        return new SortConfig("512MB", 0, null);
    }

    public SortOptions toOptions() {
        SortOptions defaults = SortOptions.defaults();
        long memory = memoryLimit != null ? ByteSize.parse(memoryLimit) : defaults.memoryLimitBytes();
        int sortThreads = threads != null ? threads : defaults.threads();
        Path temp = tempDir != null && !tempDir.isBlank() ? Path.of(tempDir) : null;
        return new SortOptions(memory, sortThreads, temp);
    }
}
