package com.affiliation.linkage.config;

import com.affiliation.linkage.name.NameConvention;
import com.affiliation.linkage.store.LoadOptions;

import java.util.Locale;

/**
 * Store section of the pipeline configuration.
 *
 * @param backend                 {@code memory} or {@code falkordb}
 * @param host                    graph database host
 * @param port                    graph database port
 * @param graphName               graph name
 * @param batchSize               rows per insert batch
 * @param referenceNameConvention how author names are written in the corpus
 * @param maxValueLength          longest accepted value
 */
public record StoreConfig(String backend, String host, Integer port, String graphName, Integer batchSize,
                          String referenceNameConvention, Integer maxValueLength) {

    public StoreConfig {
        backend = backend != null ? backend.trim().toLowerCase(Locale.ROOT) : "memory";
        if (!backend.equals("memory") && !backend.equals("falkordb")) {
            throw new IllegalArgumentException("store backend must be 'memory' or 'falkordb', was '" + backend + "'");
        }
        host = host != null ? host : "localhost";
        port = port != null ? port : 6379;
        graphName = graphName != null ? graphName : "author_references";
    }

    public static StoreConfig defaults() {
        return new StoreConfig("memory", null, null, null, null, null, null);
    }

    public boolean isGraphBackend() {
        return backend.equals("falkordb");
    }

    public NameConvention referenceConvention() {
        return referenceNameConvention != null ? NameConvention.fromString(referenceNameConvention)
                : NameConvention.GIVEN_FAMILY;
    }

    public LoadOptions toOptions() {
        LoadOptions.Builder builder = LoadOptions.builder().referenceNameConvention(referenceConvention());
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (maxValueLength != null) {
            builder.maxValueLength(maxValueLength);
        }
        return builder.build();
    }
}
