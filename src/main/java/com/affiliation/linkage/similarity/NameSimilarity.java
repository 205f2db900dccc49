package com.affiliation.linkage.similarity;

import com.affiliation.linkage.name.ParsedName;

/**
 * Compares two parsed author names.
 *
 * <p>Family names must reach the threshold under Jaro-Winkler. When both names carry a
 * given part, a single initial must agree with the other's first letter, and full given
 * names must themselves reach the threshold. When either side has no given part, a family
 * score of 0.95 or more is accepted on its own.</p>
 */
public class NameSimilarity {

    private static final double STRONG_FAMILY_SCORE = 0.95;

    private final SimilarityAlgorithm algorithm;
    private final double threshold;

    public NameSimilarity(double threshold) {
        this(new JaroWinklerSimilarity(), threshold);
    }

    public NameSimilarity(SimilarityAlgorithm algorithm, double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.algorithm = algorithm;
        this.threshold = threshold;
    }

    /**
     * Returns the family-name similarity if the names are considered the same person, otherwise 0.0.
     */
    public double score(ParsedName a, ParsedName b) {
        if (a.family().isEmpty() || b.family().isEmpty()) {
            return !a.isEmpty() && a.equals(b) ? 1.0 : 0.0;
        }
        double family = algorithm.compute(a.family(), b.family());
        if (family < threshold) {
            return 0.0;
        }
        if (!a.given().isEmpty() && !b.given().isEmpty()) {
            if (a.given().length() == 1 || b.given().length() == 1) {
                return a.initial().equals(b.initial()) ? family : 0.0;
            }
            return algorithm.compute(a.given(), b.given()) >= threshold ? family : 0.0;
        }
        return family >= STRONG_FAMILY_SCORE ? family : 0.0;
    }

    public double getThreshold() {
        return threshold;
    }
}
