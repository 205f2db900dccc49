package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.core.model.StoreRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryIndexedStore Tests")
class InMemoryIndexedStoreTest {

    private InMemoryIndexedStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryIndexedStore();
    }

    private static StoreRecord record(String documentId, String author, String affiliationKey) {
        NormalizedTriple triple = NormalizedTriple.builder()
                .documentId(documentId)
                .authorSequence(0)
                .authorName(author, author.toLowerCase())
                .build();
        return new StoreRecord(triple, author.toLowerCase(), affiliationKey, "triples.csv");
    }

    @Test
    @DisplayName("Inserting before the table exists is an error")
    void requiresTable() {
        assertThrows(IllegalStateException.class, () -> store.batchInsert(List.of(record("W1", "Doe", "oxford"))));
    }

    @Test
    @DisplayName("Rows missing a required column are returned, not stored")
    void rejectsMissingRequired() {
        store.createTable(StoreSchema.authorAffiliations());

        BatchInsertResult result = store.batchInsert(List.of(
                record("W1", "Doe", "oxford"),
                record("", "Roe", "oxford"),
                record("W2", "", "cambridge")));

        assertEquals(1, result.accepted());
        assertEquals(2, result.rejected().size());
        assertTrue(result.rejected().get(0).reason().contains("document_id"));
        assertTrue(result.rejected().get(1).reason().contains("author_name"));
        assertEquals(1, store.count());
    }

    @Test
    @DisplayName("Indexed and scanned lookups agree and keep insertion order")
    void indexedAndScanned() {
        store.createTable(StoreSchema.authorAffiliations());
        store.batchInsert(List.of(
                record("W1", "Doe", "oxford"),
                record("W2", "Roe", "cambridge"),
                record("W3", "Lee", "oxford")));

        List<StoreRecord> scanned = store.queryBy(StoreColumn.AFFILIATION_KEY, "oxford");
        assertFalse(store.hasIndex(StoreColumn.AFFILIATION_KEY));

        store.createIndex(EnumSet.of(StoreColumn.AFFILIATION_KEY));
        store.batchInsert(List.of(record("W4", "Kim", "oxford")));
        List<StoreRecord> indexed = store.queryBy(StoreColumn.AFFILIATION_KEY, "oxford");

        assertTrue(store.hasIndex(StoreColumn.AFFILIATION_KEY));
        assertEquals(List.of("W1", "W3"), scanned.stream().map(StoreRecord::documentId).collect(Collectors.toList()));
        assertEquals(List.of("W1", "W3", "W4"), indexed.stream().map(StoreRecord::documentId).collect(Collectors.toList()));
        assertTrue(store.queryBy(StoreColumn.AFFILIATION_KEY, "paris").isEmpty());
    }

    @Test
    @DisplayName("Creating the table or an index twice is harmless")
    void idempotentSetup() {
        store.createTable(StoreSchema.authorAffiliations());
        store.batchInsert(List.of(record("W1", "Doe", "oxford")));
        store.createTable(StoreSchema.authorAffiliations());
        store.createIndex(Set.of(StoreColumn.DOCUMENT_ID));
        store.createIndex(Set.of(StoreColumn.DOCUMENT_ID));

        assertEquals(1, store.count());
        assertEquals(1, store.queryBy(StoreColumn.DOCUMENT_ID, "W1").size());
    }

    @Test
    @DisplayName("Schemas validate their table name and required columns")
    void schemaValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new StoreSchema("bad name", List.of(StoreColumn.DOCUMENT_ID), Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new StoreSchema("T", List.of(StoreColumn.DOCUMENT_ID), Set.of(StoreColumn.AUTHOR_NAME)));
    }
}
