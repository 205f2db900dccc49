package com.affiliation.linkage.graph;

import java.util.List;
import java.util.Map;

/**
 * Cypher access to the single named graph that backs a {@link GraphIndexedStore}.
 * Parameters are bound by name ({@code $value}); labels and property names are never
 * taken from parameters and must pass {@link InputSanitizer#validateIdentifier(String)}.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a write query such as a node {@code CREATE}.
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Runs a read query; each returned map holds one row keyed by its {@code RETURN} aliases.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    String getGraphName();

    /**
     * Ensures an exact-match index on {@code label.property}; an existing index is left alone.
     */
    void createIndex(String label, String property);

    @Override
    void close();
}
