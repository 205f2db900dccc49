package com.affiliation.linkage.linkage;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.LinkageStatus;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a linkage run: one result per input author, plus counts per status.
 *
 * @param results            one result per input, in input order
 * @param inputDocumentRefs  every document reference named in the input
 * @param byStatus           result count per status
 * @param output             the written linkage file, or null when nothing was written
 */
public record LinkageReport(List<LinkageResult> results, Set<String> inputDocumentRefs,
                            Map<LinkageStatus, Long> byStatus, Path output) {

    public LinkageReport {
        results = List.copyOf(results);
        inputDocumentRefs = Set.copyOf(inputDocumentRefs);
        byStatus = byStatus.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(byStatus));
    }

    public static LinkageReport of(List<LinkageResult> results, Set<String> inputDocumentRefs, Path output) {
        Map<LinkageStatus, Long> counts = new EnumMap<>(LinkageStatus.class);
        for (LinkageResult result : results) {
            counts.merge(result.status(), 1L, Long::sum);
        }
        return new LinkageReport(results, inputDocumentRefs, counts, output);
    }

    public long count(LinkageStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }

    public long matched() {
        return results.stream().filter(LinkageResult::isMatched).count();
    }

    public long unmatched() {
        return results.size() - matched();
    }

    /**
     * Unmatched inputs are reported, not failures.
     */
    public boolean isSuccessful() {
        return true;
    }

    @Override
    public String toString() {
        return "LinkageReport{inputs=" + results.size() +
                ", matched=" + matched() +
                ", unmatched=" + unmatched() +
                ", byStatus=" + byStatus + '}';
    }
}
