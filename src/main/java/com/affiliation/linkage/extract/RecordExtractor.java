package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one JSON record into flat field rows. Stateless apart from its configuration,
 * so one instance can be shared by all workers.
 */
public class RecordExtractor {

    /**
     * What happened to a record.
     */
    public enum Outcome { EMITTED, FILTERED, MISSING_ID, PARSE_ERROR }

    /**
     * Outcome plus the rows produced, which are empty unless the outcome is {@link Outcome#EMITTED}.
     */
    public record Extraction(Outcome outcome, List<FlatFieldRow> rows) {

        static Extraction of(Outcome outcome) {
            return new Extraction(outcome, List.of());
        }
    }

    private final ObjectMapper objectMapper;
    private final PathTrie trie;
    private final FieldPath documentIdPath;
    private final FieldPath groupingKey1Path;
    private final FieldPath groupingKey2Path;
    private final GroupingKeyMode groupingKey2Mode;
    private final String groupingKey1Filter;
    private final String groupingKey2Filter;
    private final ObjectLeafMode objectLeafMode;

    public RecordExtractor(ExtractionOptions options, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.trie = PathTrie.compile(options.getFieldPaths());
        this.documentIdPath = FieldPath.parse(options.getDocumentIdPath());
        this.groupingKey1Path = options.getGroupingKey1Path() != null ? FieldPath.parse(options.getGroupingKey1Path()) : null;
        this.groupingKey2Path = options.getGroupingKey2Path() != null ? FieldPath.parse(options.getGroupingKey2Path()) : null;
        this.groupingKey2Mode = options.getGroupingKey2Mode();
        this.groupingKey1Filter = options.getGroupingKey1Filter();
        this.groupingKey2Filter = options.getGroupingKey2Filter();
        this.objectLeafMode = options.getObjectLeafMode();
    }

    /**
     * Parses and extracts a single line of input.
     */
    public Extraction extract(String line, String originShard) {
        JsonNode record;
        try {
            record = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return Extraction.of(Outcome.PARSE_ERROR);
        }
        if (record == null || !record.isObject()) {
            return Extraction.of(Outcome.PARSE_ERROR);
        }
        return extract(record, originShard);
    }

    /**
     * Extracts an already-parsed record.
     */
    public Extraction extract(JsonNode record, String originShard) {
        String groupingKey1 = groupingKey1Path != null ? nullToEmpty(groupingKey1Path.firstScalar(record)) : "";
        if (groupingKey1Filter != null && !groupingKey1Filter.equals(groupingKey1)) {
            return Extraction.of(Outcome.FILTERED);
        }
        String groupingKey2 = groupingKey2Path != null
                ? groupingKey2Mode.derive(groupingKey2Path.firstScalar(record))
                : "";
        if (groupingKey2Filter != null && !groupingKey2Filter.equals(groupingKey2)) {
            return Extraction.of(Outcome.FILTERED);
        }

        String documentId = documentIdPath.firstScalar(record);
        if (documentId == null || documentId.isBlank()) {
            return Extraction.of(Outcome.MISSING_ID);
        }

        List<FlatFieldRow> rows = new ArrayList<>();
        trie.walk(record, (fieldName, indexedPath, value) -> {
            String text = leafText(value);
            if (text != null) {
                rows.add(new FlatFieldRow(documentId, fieldName, indexedPath, text,
                        groupingKey1, groupingKey2, originShard));
            }
        });
        return new Extraction(Outcome.EMITTED, rows);
    }

    private String leafText(JsonNode value) {
        if (value.isNull()) {
            return "";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        if (objectLeafMode == ObjectLeafMode.SKIP) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize object leaf", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
