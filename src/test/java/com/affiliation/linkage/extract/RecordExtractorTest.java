package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordExtractor Tests")
class RecordExtractorTest {

    private static final String RECORD = "{\"id\":\"W1\",\"doi\":\"https://doi.org/10.1234/abc\","
            + "\"primary_location\":{\"source\":{\"id\":\"S9\"}},"
            + "\"authorships\":[{\"author\":{\"display_name\":\"Jane Doe\"},\"raw_affiliation_strings\":[\"Univ A\",\"Inst B\"]},"
            + "{\"author\":{\"display_name\":\"John Roe\",\"orcid\":null},\"raw_affiliation_strings\":[]}]}";

    private ExtractionOptions.Builder options() {
        return ExtractionOptions.builder()
                .fieldPaths("authorships.author.display_name", "authorships.raw_affiliation_strings")
                .groupingKey1Path("primary_location.source.id")
                .groupingKey2Path("doi");
    }

    private RecordExtractor extractor(ExtractionOptions options) {
        return new RecordExtractor(options, new ObjectMapper());
    }

    @Test
    @DisplayName("Emits one row per leaf with grouping keys and origin shard")
    void emitsRows() {
        RecordExtractor.Extraction extraction = extractor(options().build()).extract(RECORD, "part_000.gz");

        assertEquals(RecordExtractor.Outcome.EMITTED, extraction.outcome());
        assertEquals(4, extraction.rows().size());
        FlatFieldRow first = extraction.rows().get(0);
        assertEquals("W1", first.documentId());
        assertEquals("authorships.author.display_name", first.fieldName());
        assertEquals("authorships[0].author.display_name", first.indexedPath());
        assertEquals("Jane Doe", first.value());
        assertEquals("S9", first.groupingKey1());
        assertEquals("10.1234", first.groupingKey2());
        assertEquals("part_000.gz", first.originShard());
        assertEquals("authorships[0].raw_affiliation_strings[1]", extraction.rows().get(2).indexedPath());
    }

    @Test
    @DisplayName("Grouping key 2 in value mode keeps the raw value")
    void valueMode() {
        RecordExtractor.Extraction extraction = extractor(options().groupingKey2Mode(GroupingKeyMode.VALUE).build())
                .extract(RECORD, "s");
        assertEquals("https://doi.org/10.1234/abc", extraction.rows().get(0).groupingKey2());
    }

    @Test
    @DisplayName("Grouping key filters drop non-matching records")
    void filters() {
        assertEquals(RecordExtractor.Outcome.FILTERED,
                extractor(options().groupingKey2Filter("10.9999").build()).extract(RECORD, "s").outcome());
        assertEquals(RecordExtractor.Outcome.FILTERED,
                extractor(options().groupingKey1Filter("S1").build()).extract(RECORD, "s").outcome());
        assertEquals(RecordExtractor.Outcome.EMITTED,
                extractor(options().groupingKey1Filter("S9").groupingKey2Filter("10.1234").build())
                        .extract(RECORD, "s").outcome());
    }

    @Test
    @DisplayName("Records without an id are skipped")
    void missingId() {
        String record = "{\"authorships\":[{\"author\":{\"display_name\":\"X\"}}]}";
        assertEquals(RecordExtractor.Outcome.MISSING_ID, extractor(options().build()).extract(record, "s").outcome());
    }

    @Test
    @DisplayName("Invalid JSON and non-object lines are parse errors")
    void parseErrors() {
        RecordExtractor extractor = extractor(options().build());
        assertEquals(RecordExtractor.Outcome.PARSE_ERROR, extractor.extract("{not json", "s").outcome());
        assertEquals(RecordExtractor.Outcome.PARSE_ERROR, extractor.extract("[1,2,3]", "s").outcome());
    }

    @Test
    @DisplayName("Object leaves are skipped or serialized depending on the leaf mode")
    void objectLeaves() {
        ExtractionOptions.Builder builder = ExtractionOptions.builder().fieldPaths("primary_location.source");
        assertTrue(extractor(builder.build()).extract(RECORD, "s").rows().isEmpty());

        RecordExtractor serializing = extractor(builder.objectLeafMode(ObjectLeafMode.SERIALIZE).build());
        assertEquals("{\"id\":\"S9\"}", serializing.extract(RECORD, "s").rows().get(0).value());
    }

    @Test
    @DisplayName("JSON null leaves become empty values")
    void nullLeaf() {
        RecordExtractor extractor = extractor(ExtractionOptions.builder().fieldPaths("authorships.author.orcid").build());
        RecordExtractor.Extraction extraction = extractor.extract(RECORD, "s");
        assertEquals(1, extraction.rows().size());
        assertEquals("", extraction.rows().get(0).value());
    }
}
