package com.affiliation.linkage.similarity;

/**
 * Scores how alike two already-normalized strings are: 1.0 for identical text, 0.0 for
 * nothing in common. Name matching and organization matching both take one of these.
 */
@FunctionalInterface
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);
}
