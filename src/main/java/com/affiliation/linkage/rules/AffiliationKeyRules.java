package com.affiliation.linkage.rules;

import java.util.List;

/**
 * Built-in rules for deriving affiliation keys from normalized affiliation text.
 * Abbreviations are expanded first (priority 10), spelling variants unified (20),
 * then stopwords and boilerplate are dropped (50).
 */
public final class AffiliationKeyRules {
    private static final int ABBREVIATION = 10;
    private static final int SPELLING = 20;
    private static final int STOPWORD = 50;

    private AffiliationKeyRules() {
        // Utility class
    }

    /**
     * Creates an engine with all default affiliation-key rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(abbreviationRules());
        engine.addRules(spellingRules());
        engine.addRules(stopwordRules());
        return engine;
    }

    public static List<NormalizationRule> abbreviationRules() {
        return List.of(
                NormalizationRule.words("abbrev-univ", ABBREVIATION, "university", "univ", "uni"),
                NormalizationRule.words("abbrev-dept", ABBREVIATION, "department", "dept", "dep"),
                NormalizationRule.words("abbrev-inst", ABBREVIATION, "institute", "inst"),
                NormalizationRule.words("abbrev-lab", ABBREVIATION, "laboratory", "lab", "labs"),
                NormalizationRule.words("abbrev-ctr", ABBREVIATION, "center", "ctr", "cent"),
                NormalizationRule.words("abbrev-natl", ABBREVIATION, "national", "natl", "nat"),
                NormalizationRule.words("abbrev-sci", ABBREVIATION, "science", "sci"),
                NormalizationRule.words("abbrev-tech", ABBREVIATION, "technology", "tech", "technol"),
                NormalizationRule.words("abbrev-hosp", ABBREVIATION, "hospital", "hosp"),
                NormalizationRule.words("abbrev-coll", ABBREVIATION, "college", "coll"),
                NormalizationRule.words("abbrev-fac", ABBREVIATION, "faculty", "fac"),
                NormalizationRule.words("abbrev-sch", ABBREVIATION, "school", "sch"),
                NormalizationRule.words("abbrev-acad", ABBREVIATION, "academy", "acad"),
                NormalizationRule.words("abbrev-res", ABBREVIATION, "research", "res")
        );
    }

    public static List<NormalizationRule> spellingRules() {
        return List.of(
                NormalizationRule.words("spelling-centre", SPELLING, "center", "centre"),
                NormalizationRule.words("spelling-university", SPELLING, "university",
                        "universite", "universitat", "universita", "universidad", "universidade", "universiteit")
        );
    }

    public static List<NormalizationRule> stopwordRules() {
        return List.of(
                NormalizationRule.words("stopwords-english", STOPWORD, " ",
                        "the", "of", "and", "for", "at", "in", "on"),
                NormalizationRule.words("stopwords-romance-germanic", STOPWORD, " ",
                        "de", "del", "della", "des", "di", "du", "la", "le", "les", "der", "die", "das",
                        "und", "fur", "et", "y")
        );
    }
}
