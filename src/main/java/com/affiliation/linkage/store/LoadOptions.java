package com.affiliation.linkage.store;

import com.affiliation.linkage.graph.InputSanitizer;
import com.affiliation.linkage.name.NameConvention;

import java.util.EnumSet;
import java.util.Set;

/**
 * Options for {@link StoreLoader}.
 */
public class LoadOptions {

    private final int batchSize;
    private final NameConvention referenceNameConvention;
    private final int maxValueLength;
    private final Set<StoreColumn> indexColumns;

    private LoadOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.referenceNameConvention = builder.referenceNameConvention;
        this.maxValueLength = builder.maxValueLength;
        this.indexColumns = Set.copyOf(builder.indexColumns);
    }

    public static LoadOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getBatchSize() {
        return batchSize;
    }

    public NameConvention getReferenceNameConvention() {
        return referenceNameConvention;
    }

    public int getMaxValueLength() {
        return maxValueLength;
    }

    public Set<StoreColumn> getIndexColumns() {
        return indexColumns;
    }

    public static class Builder {
        private int batchSize = 5000;
        private NameConvention referenceNameConvention = NameConvention.GIVEN_FAMILY;
        private int maxValueLength = InputSanitizer.MAX_VALUE_LENGTH;
        private Set<StoreColumn> indexColumns = StoreSchema.defaultIndexColumns();

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder referenceNameConvention(NameConvention convention) {
            if (convention == null) {
                throw new IllegalArgumentException("referenceNameConvention must not be null");
            }
            this.referenceNameConvention = convention;
            return this;
        }

        public Builder maxValueLength(int maxValueLength) {
            if (maxValueLength <= 0) {
                throw new IllegalArgumentException("maxValueLength must be positive");
            }
            this.maxValueLength = maxValueLength;
            return this;
        }

        public Builder indexColumns(Set<StoreColumn> indexColumns) {
            this.indexColumns = indexColumns.isEmpty() ? Set.of() : EnumSet.copyOf(indexColumns);
            return this;
        }

        public LoadOptions build() {
            return new LoadOptions(this);
        }
    }
}
