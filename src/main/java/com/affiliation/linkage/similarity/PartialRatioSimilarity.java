package com.affiliation.linkage.similarity;

/**
 * Best-aligned substring similarity: the shorter string is slid across the longer one
 * and the highest Levenshtein similarity of any equal-length window is returned.
 * An organization name embedded in a longer affiliation line scores 1.0.
 */
public class PartialRatioSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return s1.equals(s2) ? 1.0 : 0.0;
        }

        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;
        if (longer.contains(shorter)) {
            return 1.0;
        }

        int window = shorter.length();
        double best = 0.0;
        for (int start = 0; start + window <= longer.length(); start++) {
            String slice = longer.substring(start, start + window);
            double score = 1.0 - ((double) LevenshteinSimilarity.distance(shorter, slice) / window);
            if (score > best) {
                best = score;
            }
        }
        return best;
    }
}
