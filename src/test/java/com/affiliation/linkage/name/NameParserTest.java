package com.affiliation.linkage.name;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameParser Tests")
class NameParserTest {

    @ParameterizedTest(name = "{1}: ''{0}'' -> ''{2}''")
    @CsvSource({
            "'John Smith', GIVEN_FAMILY, 'smith j'",
            "'Ludwig van Beethoven', GIVEN_FAMILY, 'van beethoven l'",
            "'Smith, John A.', FAMILY_COMMA_GIVEN, 'smith j'",
            "'Smith, J.', FAMILY_COMMA_INITIAL, 'smith j'",
            "'Smith JA', FAMILY_INITIAL, 'smith j'",
            "'Smith John', FAMILY_GIVEN, 'smith j'",
            "'Smith', FAMILY_ONLY, 'smith'",
            "'J. R. Tolkien', INITIAL_FAMILY, 'tolkien j'",
            "'Smith, John', AUTO, 'smith j'",
            "'John Smith', AUTO, 'smith j'",
            "'Hans Müller', GIVEN_FAMILY, 'muller h'",
            "'MULLER, Hans', AUTO, 'muller h'"
    })
    void derivesFamilyInitialKey(String name, NameConvention convention, String expectedKey) {
        assertEquals(expectedKey, NameParser.parse(name, convention).key());
    }

    @Test
    @DisplayName("Given and family parts are normalized")
    void partsAreNormalized() {
        ParsedName name = NameParser.parse("García Márquez, Gabriel José", NameConvention.FAMILY_COMMA_GIVEN);
        assertEquals("garcia marquez", name.family());
        assertEquals("gabriel", name.given());
        assertEquals("g", name.initial());
    }

    @Test
    @DisplayName("Blank names parse to an empty name without a key")
    void blankName() {
        ParsedName name = NameParser.parse("  ", NameConvention.AUTO);
        assertTrue(name.isEmpty());
        assertEquals("", name.key());
    }

    @Test
    @DisplayName("Separately recorded parts keep the first given name only")
    void fromParts() {
        ParsedName name = NameParser.fromParts("Marie Salomea", "Skłodowska-Curie");
        assertEquals("marie", name.given());
        assertEquals("sklodowskacurie", name.family());
        assertEquals("sklodowskacurie m", name.key());
    }

    @Nested
    @DisplayName("NameConvention.fromString")
    class ConventionParsing {

        @ParameterizedTest
        @CsvSource({
                "family_comma_given, FAMILY_COMMA_GIVEN",
                "'family, initial', FAMILY_COMMA_INITIAL",
                "given-family, GIVEN_FAMILY",
                "last_initial, FAMILY_INITIAL",
                "first_last, GIVEN_FAMILY",
                "auto, AUTO"
        })
        void parsesConfigurationText(String text, NameConvention expected) {
            assertEquals(expected, NameConvention.fromString(text));
        }

        @Test
        void blankIsAuto() {
            assertEquals(NameConvention.AUTO, NameConvention.fromString(null));
            assertEquals(NameConvention.AUTO, NameConvention.fromString(""));
        }

        @Test
        void unknownIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> NameConvention.fromString("surname_first_maybe"));
        }
    }
}
