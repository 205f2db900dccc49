package com.affiliation.linkage.extract;

import java.util.Locale;

/**
 * How a grouping key is derived from the value found at its path.
 */
public enum GroupingKeyMode {
    /** Use the value as-is. */
    VALUE,
    /** Treat the value as a DOI and keep its registrant prefix, e.g. {@code 10.1234}. */
    DOI_PREFIX;

    private static final String[] DOI_URL_PREFIXES = {
            "https://doi.org/", "http://doi.org/", "https://dx.doi.org/", "http://dx.doi.org/", "doi:"
    };

    public String derive(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (this == VALUE) {
            return value;
        }
        String doi = stripDoiUrl(value.trim());
        int slash = doi.indexOf('/');
        return slash < 0 ? doi : doi.substring(0, slash);
    }

    /**
     * Removes resolver URL or {@code doi:} prefixes from a DOI and lowercases it.
     */
    public static String stripDoiUrl(String doi) {
        String lower = doi.trim().toLowerCase(Locale.ROOT);
        for (String prefix : DOI_URL_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return lower.substring(prefix.length());
            }
        }
        return lower;
    }
}
