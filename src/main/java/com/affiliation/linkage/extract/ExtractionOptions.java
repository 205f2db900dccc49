package com.affiliation.linkage.extract;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for the path extractor.
 */
public final class ExtractionOptions {

    private final List<String> fieldPaths;
    private final String documentIdPath;
    private final String groupingKey1Path;
    private final String groupingKey2Path;
    private final GroupingKeyMode groupingKey2Mode;
    private final String groupingKey1Filter;
    private final String groupingKey2Filter;
    private final int threads;
    private final int batchSize;
    private final int maxOpenFiles;
    private final ObjectLeafMode objectLeafMode;
    private final String shardSuffix;

    private ExtractionOptions(Builder builder) {
        this.fieldPaths = List.copyOf(builder.fieldPaths);
        this.documentIdPath = builder.documentIdPath;
        this.groupingKey1Path = builder.groupingKey1Path;
        this.groupingKey2Path = builder.groupingKey2Path;
        this.groupingKey2Mode = builder.groupingKey2Mode;
        this.groupingKey1Filter = emptyToNull(builder.groupingKey1Filter);
        this.groupingKey2Filter = emptyToNull(builder.groupingKey2Filter);
        this.threads = builder.threads;
        this.batchSize = builder.batchSize;
        this.maxOpenFiles = builder.maxOpenFiles;
        this.objectLeafMode = builder.objectLeafMode;
        this.shardSuffix = builder.shardSuffix;
    }

    public List<String> getFieldPaths() {
        return fieldPaths;
    }

    public String getDocumentIdPath() {
        return documentIdPath;
    }

    public String getGroupingKey1Path() {
        return groupingKey1Path;
    }

    public String getGroupingKey2Path() {
        return groupingKey2Path;
    }

    public GroupingKeyMode getGroupingKey2Mode() {
        return groupingKey2Mode;
    }

    public String getGroupingKey1Filter() {
        return groupingKey1Filter;
    }

    public String getGroupingKey2Filter() {
        return groupingKey2Filter;
    }

    /**
     * Number of worker threads; 0 means one per available processor.
     */
    public int getThreads() {
        return threads;
    }

    public int effectiveThreads() {
        return threads == 0 ? Runtime.getRuntime().availableProcessors() : threads;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxOpenFiles() {
        return maxOpenFiles;
    }

    public ObjectLeafMode getObjectLeafMode() {
        return objectLeafMode;
    }

    public String getShardSuffix() {
        return shardSuffix;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> fieldPaths = List.of();
        private String documentIdPath = "id";
        private String groupingKey1Path;
        private String groupingKey2Path;
        private GroupingKeyMode groupingKey2Mode = GroupingKeyMode.DOI_PREFIX;
        private String groupingKey1Filter;
        private String groupingKey2Filter;
        private int threads = 0;
        private int batchSize = 10_000;
        private int maxOpenFiles = 64;
        private ObjectLeafMode objectLeafMode = ObjectLeafMode.SKIP;
        private String shardSuffix = ".gz";

        public Builder fieldPaths(List<String> fieldPaths) {
            this.fieldPaths = fieldPaths;
            return this;
        }

        public Builder fieldPaths(String... fieldPaths) {
            this.fieldPaths = List.of(fieldPaths);
            return this;
        }

        public Builder documentIdPath(String documentIdPath) {
            this.documentIdPath = documentIdPath;
            return this;
        }

        public Builder groupingKey1Path(String groupingKey1Path) {
            this.groupingKey1Path = groupingKey1Path;
            return this;
        }

        public Builder groupingKey2Path(String groupingKey2Path) {
            this.groupingKey2Path = groupingKey2Path;
            return this;
        }

        public Builder groupingKey2Mode(GroupingKeyMode groupingKey2Mode) {
            this.groupingKey2Mode = groupingKey2Mode;
            return this;
        }

        public Builder groupingKey1Filter(String groupingKey1Filter) {
            this.groupingKey1Filter = groupingKey1Filter;
            return this;
        }

        public Builder groupingKey2Filter(String groupingKey2Filter) {
            this.groupingKey2Filter = groupingKey2Filter;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxOpenFiles(int maxOpenFiles) {
            this.maxOpenFiles = maxOpenFiles;
            return this;
        }

        public Builder objectLeafMode(ObjectLeafMode objectLeafMode) {
            this.objectLeafMode = objectLeafMode;
            return this;
        }

        public Builder shardSuffix(String shardSuffix) {
            this.shardSuffix = shardSuffix;
            return this;
        }

        public ExtractionOptions build() {
            Objects.requireNonNull(fieldPaths, "fieldPaths is required");
            if (fieldPaths.isEmpty()) {
                throw new IllegalArgumentException("At least one field path is required");
            }
            Objects.requireNonNull(documentIdPath, "documentIdPath is required");
            Objects.requireNonNull(groupingKey2Mode, "groupingKey2Mode is required");
            Objects.requireNonNull(objectLeafMode, "objectLeafMode is required");
            if (threads < 0) {
                throw new IllegalArgumentException("threads must be >= 0");
            }
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be > 0");
            }
            if (maxOpenFiles <= 0) {
                throw new IllegalArgumentException("maxOpenFiles must be > 0");
            }
            return new ExtractionOptions(this);
        }
    }
}
