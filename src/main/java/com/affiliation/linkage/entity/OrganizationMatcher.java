package com.affiliation.linkage.entity;

import com.affiliation.linkage.rules.TextNormalizer;
import com.affiliation.linkage.similarity.PartialRatioSimilarity;
import com.affiliation.linkage.similarity.SimilarityAlgorithm;

import java.util.List;
import java.util.Optional;

/**
 * Compares organizations extracted from affiliation text against the configured organization variants.
 */
public class OrganizationMatcher {

    private final EntityExtractor extractor;
    private final SimilarityAlgorithm similarity;
    private final double threshold;

    public OrganizationMatcher(EntityExtractor extractor, double threshold) {
        this(extractor, new PartialRatioSimilarity(), threshold);
    }

    public OrganizationMatcher(EntityExtractor extractor, SimilarityAlgorithm similarity, double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.extractor = extractor;
        this.similarity = similarity;
        this.threshold = threshold;
    }

    /**
     * Extracts organizations from the text and returns the best one whose similarity to a
     * normalized variant reaches the threshold.
     *
     * @param text               raw affiliation text
     * @param normalizedVariants organization variants, already normalized
     */
    public Optional<Match> bestMatch(String text, List<String> normalizedVariants) {
        if (normalizedVariants.isEmpty() || text == null || text.isBlank()) {
            return Optional.empty();
        }
        Match best = null;
        for (OrganizationCandidate candidate : extractor.extractOrganizations(text)) {
            Optional<Match> match = score(candidate, normalizedVariants);
            if (match.isPresent() && (best == null || match.get().score() > best.score())) {
                best = match.get();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Scores a single candidate against the variants.
     */
    public Optional<Match> score(OrganizationCandidate candidate, List<String> normalizedVariants) {
        String normalized = TextNormalizer.normalize(candidate.text());
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Match best = null;
        for (String variant : normalizedVariants) {
            double score = similarity.compute(normalized, variant);
            if (score >= threshold && (best == null || score > best.score())) {
                best = new Match(candidate, variant, score);
            }
        }
        return Optional.ofNullable(best);
    }

    public List<OrganizationCandidate> extract(String text) {
        return extractor.extractOrganizations(text);
    }

    public boolean isAvailable() {
        return extractor.isAvailable();
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * A candidate that resembles a variant.
     *
     * @param candidate the extracted organization
     * @param variant   the normalized variant it resembles
     * @param score     similarity between the two
     */
    public record Match(OrganizationCandidate candidate, String variant, double score) {}
}
