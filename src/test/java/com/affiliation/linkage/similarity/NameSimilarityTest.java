package com.affiliation.linkage.similarity;

import com.affiliation.linkage.name.ParsedName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Tests")
class NameSimilarityTest {

    @Nested
    @DisplayName("NameSimilarity")
    class NameTests {

        private final NameSimilarity similarity = new NameSimilarity(0.85);

        @Test
        @DisplayName("A close family name with the same initial matches")
        void typoInFamilyName() {
            double score = similarity.score(new ParsedName("j", "smith"), new ParsedName("john", "smyth"));
            assertTrue(score >= 0.85, "score was " + score);
            assertTrue(score < 1.0);
        }

        @Test
        @DisplayName("Identical names score 1.0")
        void identical() {
            assertEquals(1.0, similarity.score(new ParsedName("john", "smith"), new ParsedName("john", "smith")));
        }

        @Test
        @DisplayName("Different initials never match, even with the same family name")
        void differentInitials() {
            assertEquals(0.0, similarity.score(new ParsedName("j", "smith"), new ParsedName("k", "smith")));
        }

        @Test
        @DisplayName("Different full given names do not match")
        void differentGivenNames() {
            assertEquals(0.0, similarity.score(new ParsedName("john", "smith"), new ParsedName("peter", "smith")));
        }

        @Test
        @DisplayName("A strong family match is accepted when one side has no given part")
        void familyOnly() {
            assertEquals(1.0, similarity.score(new ParsedName("", "smith"), new ParsedName("john", "smith")));
            assertEquals(0.0, similarity.score(new ParsedName("", "smith"), new ParsedName("john", "jones")));
        }

        @Test
        @DisplayName("Threshold outside 0..1 is rejected")
        void invalidThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new NameSimilarity(1.5));
        }
    }

    @Nested
    @DisplayName("PartialRatioSimilarity")
    class PartialRatioTests {

        private final PartialRatioSimilarity similarity = new PartialRatioSimilarity();

        @Test
        @DisplayName("A name embedded in a longer affiliation scores 1.0")
        void embedded() {
            assertEquals(1.0, similarity.compute("university of oxford", "department of physics university of oxford"));
        }

        @Test
        @DisplayName("A near miss scores below 1.0 but stays high")
        void nearMiss() {
            double score = similarity.compute("university of oxfrd", "department of physics university of oxford");
            assertTrue(score > 0.85 && score < 1.0, "score was " + score);
        }

        @Test
        @DisplayName("Empty strings only match each other")
        void empty() {
            assertEquals(1.0, similarity.compute("", ""));
            assertEquals(0.0, similarity.compute("", "oxford"));
        }
    }

    @Nested
    @DisplayName("JaroWinklerSimilarity")
    class JaroWinklerTests {

        private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

        @Test
        void symmetric() {
            assertEquals(similarity.compute("martha", "marhta"), similarity.compute("marhta", "martha"), 1e-9);
        }

        @Test
        void classicExample() {
            assertEquals(0.961, similarity.compute("martha", "marhta"), 0.001);
        }

        @Test
        void zeroPrefixWeightIsPlainJaro() {
            assertEquals(0.944, new JaroWinklerSimilarity(0.0).compute("martha", "marhta"), 0.001);
            assertEquals(0.822, new JaroWinklerSimilarity(0.0).compute("dwayne", "duane"), 0.001);
        }

        @Test
        void rejectsPrefixWeightAboveQuarter() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3));
        }
    }
}
