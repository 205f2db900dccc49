package com.affiliation.linkage.graph;

/**
 * Validation for values written to a store.
 * Rejects control characters and oversized values, which also keeps
 * substituted Cypher literals bounded.
 */
public final class InputSanitizer {

    /** Maximum allowed length for a stored text value. */
    public static final int MAX_VALUE_LENGTH = 4000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a text value for storage.
     *
     * @param column    column name, used in the message
     * @param value     the value, may be null or empty
     * @param maxLength maximum allowed length
     * @throws IllegalArgumentException if the value is invalid
     */
    public static void validateValue(String column, String value, int maxLength) {
        if (value == null) {
            return;
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(
                    column + " exceeds maximum length of " + maxLength + " characters (was " + value.length() + ")");
        }
        if (containsControlCharacters(value)) {
            throw new IllegalArgumentException(column + " must not contain control characters");
        }
    }

    /**
     * Validates a label or property identifier used verbatim in a Cypher query.
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || !identifier.matches("^[A-Za-z][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException("Invalid identifier: '" + identifier + "'");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
