package com.affiliation.linkage.rules;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A case-insensitive rewrite applied while deriving affiliation keys. Lower priorities run first.
 *
 * @param name        rule name, used in trace logging
 * @param pattern     compiled pattern
 * @param replacement replacement text
 * @param priority    ordering among rules
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Rule rewriting every match of {@code regex}.
     */
    public static NormalizationRule regex(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, priority);
    }

    /**
     * Rule rewriting any of the given whole words to {@code replacement}.
     */
    public static NormalizationRule words(String name, int priority, String replacement, String... words) {
        if (words.length == 0) {
            throw new IllegalArgumentException("at least one word is required");
        }
        String alternation = Arrays.stream(words).map(Pattern::quote).collect(Collectors.joining("|"));
        return regex(name, "\\b(?:" + alternation + ")\\b", replacement, priority);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }
}
