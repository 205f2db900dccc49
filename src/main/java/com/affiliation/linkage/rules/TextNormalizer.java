package com.affiliation.linkage.rules;

import com.ibm.icu.text.Transliterator;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The normalization function applied to author names and affiliation strings.
 *
 * <p>Steps: compatibility-decompose (NFKD) and drop combining marks, transliterate to
 * ASCII (other scripts via romanization; ß, æ, ø, ł and the like via their Latin
 * spellings), lowercase, remove everything that is not a letter, digit or whitespace,
 * collapse whitespace, trim. Lowercasing runs after decomposition: some
 * compatibility characters decompose to capitals (ℌ to H).</p>
 *
 * <p>The function is pure and idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 */
public final class TextNormalizer {

    private static final String TRANSLITERATION_ID = "Any-Latin; Latin-ASCII";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // Transliterator instances are not safe for concurrent use.
    private static final ThreadLocal<Transliterator> TO_ASCII =
            ThreadLocal.withInitial(() -> Transliterator.getInstance(TRANSLITERATION_ID));

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Normalizes the given text. Null and blank input yield the empty string.
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String unmarked = stripMarks(text);
        String ascii = stripMarks(TO_ASCII.get().transliterate(unmarked));
        String lower = ascii.toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static String stripMarks(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
