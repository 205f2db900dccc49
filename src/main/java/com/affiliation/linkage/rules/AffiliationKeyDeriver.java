package com.affiliation.linkage.rules;

/**
 * Derives the canonical affiliation key used as the store's equality lookup key.
 * The key is a pure function of the normalized affiliation text; feeding raw text is also
 * accepted because {@link TextNormalizer#normalize} is idempotent.
 */
public class AffiliationKeyDeriver {

    private final NormalizationEngine engine;

    public AffiliationKeyDeriver() {
        this(AffiliationKeyRules.createDefaultEngine());
    }

    public AffiliationKeyDeriver(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Returns the affiliation key for the given affiliation text, or the empty string for blank input.
     */
    public String deriveKey(String affiliation) {
        return engine.apply(TextNormalizer.normalize(affiliation));
    }
}
