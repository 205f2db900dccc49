package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.name.NameConvention;
import com.affiliation.linkage.name.NameParser;
import com.affiliation.linkage.name.ParsedName;

/**
 * Derives the "family initial" author key for stored rows.
 * Separately recorded given/family parts win over the display name, which is
 * otherwise parsed with the reference name convention of the corpus.
 */
public class AuthorKeyDeriver {

    private final NameConvention referenceConvention;

    public AuthorKeyDeriver(NameConvention referenceConvention) {
        this.referenceConvention = referenceConvention;
    }

    public ParsedName parse(NormalizedTriple triple) {
        if (!triple.familyNameOriginal().isBlank()) {
            return NameParser.fromParts(triple.givenNameOriginal(), triple.familyNameOriginal());
        }
        return NameParser.parse(triple.authorNameOriginal(), referenceConvention);
    }

    public String deriveKey(NormalizedTriple triple) {
        return parse(triple).key();
    }

    public NameConvention getReferenceConvention() {
        return referenceConvention;
    }
}
