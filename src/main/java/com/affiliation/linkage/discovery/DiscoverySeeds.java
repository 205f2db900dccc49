package com.affiliation.linkage.discovery;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.entity.OrganizationCandidate;
import com.affiliation.linkage.entity.OrganizationMatcher;
import com.affiliation.linkage.linkage.DocumentRefMode;
import com.affiliation.linkage.rules.AffiliationKeyDeriver;
import com.affiliation.linkage.rules.TextNormalizer;
import com.affiliation.linkage.store.IndexedStore;
import com.affiliation.linkage.store.StoreColumn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builders for the three discovery entry points, plus entity-derived seeds.
 */
public final class DiscoverySeeds {

    /** Extracted organizations with a shorter normalized form are too generic to search by. */
    static final int MIN_ENTITY_LENGTH = 16;

    private DiscoverySeeds() {
        // Utility class
    }

    /**
     * Seeds from a prior linkage run. Only results whose status seeds discovery are used.
     * Every input document reference and every matched document id is excluded.
     */
    public static SeedSet fromLinkage(Collection<LinkageResult> results) {
        return fromLinkage(results, List.of(), DocumentRefMode.AS_IS);
    }

    /**
     * Seeds from the same results plus any extra input document references (such as documents
     * whose authors were all blank) that must be excluded too.
     */
    public static SeedSet fromLinkage(Collection<LinkageResult> results, Collection<String> inputDocumentRefs) {
        return fromLinkage(results, inputDocumentRefs, DocumentRefMode.AS_IS);
    }

    /**
     * Seeds from a prior linkage run whose references were resolved with {@code refMode}. Every
     * stored id an input reference can resolve to is excluded, including references whose
     * authors went unmatched.
     */
    public static SeedSet fromLinkage(Collection<LinkageResult> results, Collection<String> inputDocumentRefs,
                                      DocumentRefMode refMode) {
        List<DiscoverySeed> seeds = new ArrayList<>();
        Set<String> excluded = new LinkedHashSet<>();
        for (LinkageResult result : results) {
            excluded.addAll(refMode.lookupForms(result.externalDocumentRef()));
            addIfPresent(excluded, result.matchedDocumentId());
            if (result.status().isDiscoverySeed() && !result.matchedAffiliationKey().isEmpty()) {
                seeds.add(new DiscoverySeed(result.matchedAffiliationKey(), SeedSource.LINKAGE,
                        result.matchedAffiliationOriginal(), result.matchedDocumentId(),
                        result.matchedAuthorSequence()));
            }
        }
        for (String ref : inputDocumentRefs) {
            excluded.addAll(refMode.lookupForms(ref));
        }
        return new SeedSet(seeds, excluded, List.of());
    }

    /**
     * Seeds from caller-supplied affiliation names, keyed the same way stored affiliations are.
     */
    public static SeedSet fromAffiliationNames(Collection<String> names, AffiliationKeyDeriver deriver) {
        List<DiscoverySeed> seeds = new ArrayList<>();
        List<UnmatchedInput> unmatched = new ArrayList<>();
        for (String name : names) {
            String key = deriver.deriveKey(name);
            if (key.isEmpty()) {
                unmatched.add(new UnmatchedInput(name, SeedSource.AFFILIATION_NAME, "name has an empty affiliation key"));
                continue;
            }
            seeds.add(new DiscoverySeed(key, SeedSource.AFFILIATION_NAME, name, "", null));
        }
        return new SeedSet(seeds, Set.of(), unmatched);
    }

    /**
     * Seeds from the stored affiliations of caller-supplied documents. When normalized variants are
     * given, only affiliations whose normalized text contains one of them are used.
     */
    public static SeedSet fromDocumentIds(IndexedStore store, Collection<String> documentIds,
                                          List<String> normalizedVariants) {
        List<DiscoverySeed> seeds = new ArrayList<>();
        Set<String> excluded = new LinkedHashSet<>();
        List<UnmatchedInput> unmatched = new ArrayList<>();
        for (String raw : documentIds) {
            String documentId = raw.trim();
            if (documentId.isEmpty()) {
                continue;
            }
            excluded.add(documentId);
            List<StoreRecord> rows = store.queryBy(StoreColumn.DOCUMENT_ID, documentId);
            if (rows.isEmpty()) {
                unmatched.add(new UnmatchedInput(documentId, SeedSource.DOCUMENT_ID, "document not found in store"));
                continue;
            }
            int before = seeds.size();
            for (StoreRecord row : rows) {
                if (row.affiliationKey().isEmpty() || !containsAny(row.triple().affiliationNameNormalized(), normalizedVariants)) {
                    continue;
                }
                seeds.add(new DiscoverySeed(row.affiliationKey(), SeedSource.DOCUMENT_ID, documentId,
                        documentId, row.authorSequence()));
            }
            if (seeds.size() == before) {
                unmatched.add(new UnmatchedInput(documentId, SeedSource.DOCUMENT_ID,
                        normalizedVariants.isEmpty() ? "document has no affiliations"
                                : "no affiliation of the document contains an organization variant"));
            }
        }
        return new SeedSet(seeds, excluded, unmatched);
    }

    /**
     * Seeds from organizations extracted out of the matched affiliations of linkage results.
     * Acronyms and short names are ignored, and a candidate must resemble a normalized variant.
     */
    public static SeedSet fromEntities(Collection<LinkageResult> results, OrganizationMatcher matcher,
                                       List<String> normalizedVariants, AffiliationKeyDeriver deriver) {
        List<DiscoverySeed> seeds = new ArrayList<>();
        Set<String> excluded = new LinkedHashSet<>();
        Set<String> seenAffiliations = new LinkedHashSet<>();
        for (LinkageResult result : results) {
            addIfPresent(excluded, result.externalDocumentRef());
            addIfPresent(excluded, result.matchedDocumentId());
            String affiliation = result.matchedAffiliationOriginal();
            if (!result.status().isDiscoverySeed() || affiliation.isEmpty() || !seenAffiliations.add(affiliation)) {
                continue;
            }
            for (OrganizationCandidate candidate : matcher.extract(affiliation)) {
                if (!isSearchable(candidate)) {
                    continue;
                }
                Optional<OrganizationMatcher.Match> match = matcher.score(candidate, normalizedVariants);
                String key = deriver.deriveKey(candidate.text());
                if (match.isPresent() && !key.isEmpty()) {
                    seeds.add(new DiscoverySeed(key, SeedSource.ENTITY, candidate.text(),
                            result.matchedDocumentId(), result.matchedAuthorSequence()));
                }
            }
        }
        return new SeedSet(seeds, excluded, List.of());
    }

    /**
     * Combines seed sets; exclusions and unmatched inputs are unioned.
     */
    public static SeedSet combine(SeedSet first, SeedSet second) {
        List<DiscoverySeed> seeds = new ArrayList<>(first.seeds());
        seeds.addAll(second.seeds());
        Set<String> excluded = new LinkedHashSet<>(first.excludedDocuments());
        excluded.addAll(second.excludedDocuments());
        List<UnmatchedInput> unmatched = new ArrayList<>(first.unmatched());
        unmatched.addAll(second.unmatched());
        return new SeedSet(seeds, excluded, unmatched);
    }

    static boolean isSearchable(OrganizationCandidate candidate) {
        return !candidate.isLikelyAcronym() && TextNormalizer.normalize(candidate.text()).length() >= MIN_ENTITY_LENGTH;
    }

    private static boolean containsAny(String text, List<String> variants) {
        if (variants.isEmpty()) {
            return true;
        }
        for (String variant : variants) {
            if (text.contains(variant)) {
                return true;
            }
        }
        return false;
    }

    private static void addIfPresent(Set<String> set, String value) {
        if (value != null && !value.isBlank()) {
            set.add(value.trim());
        }
    }
}
