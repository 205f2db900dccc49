package com.affiliation.linkage.similarity;

/**
 * Jaro similarity with the Winkler boost for a shared prefix of up to four characters.
 * Used for family names, where typos rarely hit the first letters.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final int BOOSTED_PREFIX = 4;

    private final double prefixWeight;

    public JaroWinklerSimilarity() {
        this(0.1);
    }

    /**
     * @param prefixWeight boost per shared leading character; above 0.25 scores could exceed 1.0
     */
    public JaroWinklerSimilarity(double prefixWeight) {
        if (prefixWeight < 0 || prefixWeight > 0.25) {
            throw new IllegalArgumentException("prefixWeight must be between 0 and 0.25, got " + prefixWeight);
        }
        this.prefixWeight = prefixWeight;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        double jaro = jaro(s1.toCharArray(), s2.toCharArray());
        return jaro + sharedPrefix(s1, s2) * prefixWeight * (1.0 - jaro);
    }

    private static int sharedPrefix(String a, String b) {
        int max = Math.min(BOOSTED_PREFIX, Math.min(a.length(), b.length()));
        int n = 0;
        while (n < max && a.charAt(n) == b.charAt(n)) {
            n++;
        }
        return n;
    }

    static double jaro(char[] a, char[] b) {
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        int reach = Math.max(0, Math.max(a.length, b.length) / 2 - 1);
        boolean[] takenInB = new boolean[b.length];
        char[] commonA = new char[a.length];
        int common = 0;
        for (int i = 0; i < a.length; i++) {
            int from = Math.max(0, i - reach);
            int to = Math.min(b.length, i + reach + 1);
            for (int j = from; j < to; j++) {
                if (!takenInB[j] && a[i] == b[j]) {
                    takenInB[j] = true;
                    commonA[common++] = a[i];
                    break;
                }
            }
        }
        if (common == 0) {
            return 0.0;
        }

        // common characters of b, in b's order, compared against those of a
        int outOfOrder = 0;
        int next = 0;
        for (int j = 0; j < b.length; j++) {
            if (takenInB[j] && b[j] != commonA[next++]) {
                outOfOrder++;
            }
        }
        double m = common;
        return (m / a.length + m / b.length + (m - outOfOrder / 2.0) / m) / 3.0;
    }
}
