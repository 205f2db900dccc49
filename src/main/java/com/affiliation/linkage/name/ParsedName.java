package com.affiliation.linkage.name;

import java.util.Objects;

/**
 * A name split into normalized given and family parts.
 *
 * @param given  normalized given name or initials, possibly empty
 * @param family normalized family name, possibly empty
 */
public record ParsedName(String given, String family) {

    public ParsedName {
        given = Objects.requireNonNullElse(given, "");
        family = Objects.requireNonNullElse(family, "");
    }

    public static ParsedName empty() {
        return new ParsedName("", "");
    }

    public boolean isEmpty() {
        return given.isEmpty() && family.isEmpty();
    }

    public String initial() {
        return given.isEmpty() ? "" : given.substring(0, 1);
    }

    /**
     * The canonical "family initial" lookup key, e.g. {@code smith j}.
     * A name without a family part has no key.
     */
    public String key() {
        if (family.isEmpty()) {
            return "";
        }
        return given.isEmpty() ? family : family + " " + initial();
    }
}
