package com.affiliation.linkage.name;

import com.affiliation.linkage.rules.TextNormalizer;

import java.util.Arrays;
import java.util.Set;

/**
 * Splits author names written in a known {@link NameConvention} into normalized parts.
 * Comma conventions are split before normalization, since normalization removes the comma.
 */
public final class NameParser {

    private static final Set<String> FAMILY_PARTICLES = Set.of(
            "van", "von", "der", "den", "de", "da", "del", "della", "di", "du", "dos", "das",
            "la", "le", "ten", "ter", "bin", "al", "el", "mac", "st");

    private NameParser() {
        // Utility class
    }

    public static ParsedName parse(String name, NameConvention convention) {
        if (name == null || name.isBlank()) {
            return ParsedName.empty();
        }
        return switch (convention) {
            case GIVEN_FAMILY -> givenFamily(TextNormalizer.normalize(name));
            case FAMILY_COMMA_GIVEN -> familyComma(name, false);
            case FAMILY_COMMA_INITIAL -> familyComma(name, true);
            case FAMILY_INITIAL -> familyInitial(TextNormalizer.normalize(name));
            case FAMILY_GIVEN -> familyGiven(TextNormalizer.normalize(name));
            case FAMILY_ONLY -> new ParsedName("", TextNormalizer.normalize(name));
            case INITIAL_FAMILY -> initialFamily(name);
            case AUTO -> name.contains(",") ? familyComma(name, false) : givenFamily(TextNormalizer.normalize(name));
        };
    }

    /**
     * Builds a name from separately recorded given and family parts.
     */
    public static ParsedName fromParts(String given, String family) {
        String normalizedGiven = TextNormalizer.normalize(given);
        String firstGiven = normalizedGiven.isEmpty() ? "" : normalizedGiven.split(" ")[0];
        return new ParsedName(firstGiven, TextNormalizer.normalize(family));
    }

    private static ParsedName givenFamily(String normalized) {
        String[] tokens = tokens(normalized);
        if (tokens.length == 0) {
            return ParsedName.empty();
        }
        if (tokens.length == 1) {
            return new ParsedName("", tokens[0]);
        }
        int familyStart = tokens.length - 1;
        for (int i = 1; i < tokens.length - 1; i++) {
            if (FAMILY_PARTICLES.contains(tokens[i])) {
                familyStart = i;
                break;
            }
        }
        return new ParsedName(tokens[0], join(tokens, familyStart, tokens.length));
    }

    private static ParsedName familyComma(String name, boolean initialOnly) {
        int comma = name.indexOf(',');
        if (comma < 0) {
            return initialOnly ? familyInitial(TextNormalizer.normalize(name))
                    : givenFamily(TextNormalizer.normalize(name));
        }
        String family = TextNormalizer.normalize(name.substring(0, comma));
        String[] rest = tokens(TextNormalizer.normalize(name.substring(comma + 1)));
        String given = rest.length == 0 ? "" : rest[0];
        if (initialOnly && !given.isEmpty()) {
            given = given.substring(0, 1);
        }
        return new ParsedName(given, family);
    }

    private static ParsedName familyInitial(String normalized) {
        String[] tokens = tokens(normalized);
        if (tokens.length < 2) {
            return new ParsedName("", normalized);
        }
        String initials = tokens[tokens.length - 1];
        return new ParsedName(initials.substring(0, 1), join(tokens, 0, tokens.length - 1));
    }

    private static ParsedName familyGiven(String normalized) {
        String[] tokens = tokens(normalized);
        if (tokens.length < 2) {
            return new ParsedName("", normalized);
        }
        return new ParsedName(tokens[1], tokens[0]);
    }

    private static ParsedName initialFamily(String name) {
        String[] raw = name.trim().split("\\s+");
        StringBuilder initials = new StringBuilder();
        int familyStart = -1;
        for (int i = 0; i < raw.length; i++) {
            String part = raw[i];
            if (part.length() == 1 || (part.length() <= 2 && part.endsWith("."))) {
                initials.append(part.charAt(0));
            } else {
                familyStart = i;
                break;
            }
        }
        if (familyStart < 0) {
            return givenFamily(TextNormalizer.normalize(name));
        }
        String family = TextNormalizer.normalize(String.join(" ", Arrays.copyOfRange(raw, familyStart, raw.length)));
        String given = TextNormalizer.normalize(initials.toString());
        return new ParsedName(given.isEmpty() ? "" : given.substring(0, 1), family);
    }

    private static String[] tokens(String normalized) {
        return normalized.isEmpty() ? new String[0] : normalized.split(" ");
    }

    private static String join(String[] tokens, int from, int to) {
        return String.join(" ", Arrays.copyOfRange(tokens, from, to));
    }
}
