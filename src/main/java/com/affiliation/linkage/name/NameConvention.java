package com.affiliation.linkage.name;

import java.util.Locale;

/**
 * The ways an author name can be written in an external file.
 */
public enum NameConvention {
    /** "Jane Smith". */
    GIVEN_FAMILY,
    /** "Smith, Jane". */
    FAMILY_COMMA_GIVEN,
    /** "Smith J" or "Smith JA". */
    FAMILY_INITIAL,
    /** "Smith Jane". */
    FAMILY_GIVEN,
    /** "Smith, J." */
    FAMILY_COMMA_INITIAL,
    /** "Smith". */
    FAMILY_ONLY,
    /** "J. A. Smith". */
    INITIAL_FAMILY,
    /** Comma present: family-comma-given, otherwise given-family. */
    AUTO;

    /**
     * Parses a convention from configuration text such as {@code family_comma_given},
     * {@code family, initial} or the legacy {@code last_initial}.
     */
    public static NameConvention fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String key = value.trim().toUpperCase(Locale.ROOT)
                .replace(", ", "_COMMA_")
                .replace(",", "_COMMA_")
                .replace('-', '_')
                .replace(' ', '_');
        return switch (key) {
            case "FIRST_LAST" -> GIVEN_FAMILY;
            case "LAST_COMMA_FIRST" -> FAMILY_COMMA_GIVEN;
            case "LAST_INITIAL" -> FAMILY_INITIAL;
            case "LAST_FIRST" -> FAMILY_GIVEN;
            case "LAST_COMMA_INITIAL" -> FAMILY_COMMA_INITIAL;
            case "LAST_ONLY" -> FAMILY_ONLY;
            case "FIRST_INITIAL_LAST" -> INITIAL_FAMILY;
            default -> valueOf(key);
        };
    }
}
