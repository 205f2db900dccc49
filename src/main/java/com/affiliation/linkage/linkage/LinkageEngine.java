package com.affiliation.linkage.linkage;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.MatchBasis;
import com.affiliation.linkage.core.model.StoreRecord;
import com.affiliation.linkage.entity.EntityExtractor;
import com.affiliation.linkage.entity.NoOpEntityExtractor;
import com.affiliation.linkage.entity.OrganizationMatcher;
import com.affiliation.linkage.io.LinkageResultCodec;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.name.NameParser;
import com.affiliation.linkage.name.ParsedName;
import com.affiliation.linkage.pipeline.CancellationToken;
import com.affiliation.linkage.pipeline.PipelineException;
import com.affiliation.linkage.pipeline.Stage;
import com.affiliation.linkage.similarity.NameSimilarity;
import com.affiliation.linkage.store.AuthorKeyDeriver;
import com.affiliation.linkage.store.IndexedStore;
import com.affiliation.linkage.store.StoreColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves external (document, author) references to stored affiliations.
 *
 * <p>The document is looked up first. The author is then found by exact "family initial" key,
 * falling back to fuzzy name comparison against the document's stored authors. Among the author's
 * affiliations, one is chosen by {@link AffiliationDisambiguator}. Entity extraction is consulted
 * only to corroborate a direct match or when no affiliation contains a variant.</p>
 *
 * <p>Every input yields exactly one {@link LinkageResult}.</p>
 */
public class LinkageEngine {
    private static final Logger log = LoggerFactory.getLogger(LinkageEngine.class);

    private static final double SEVERAL_AFFILIATIONS_FACTOR = 0.8;
    private static final double NO_ORG_MATCH_FACTOR = 0.5;

    private final IndexedStore store;
    private final LinkageOptions options;
    private final NameSimilarity nameSimilarity;
    private final AuthorKeyDeriver storedNames;
    private final AffiliationDisambiguator disambiguator = new AffiliationDisambiguator();
    private final OrganizationMatcher organizationMatcher;
    private final MetricsService metrics;

    public LinkageEngine(IndexedStore store, LinkageOptions options) {
        this(store, options, new NoOpEntityExtractor(), new NoOpMetricsService());
    }

    public LinkageEngine(IndexedStore store, LinkageOptions options, EntityExtractor extractor,
                         MetricsService metrics) {
        this.store = store;
        this.options = options;
        this.nameSimilarity = new NameSimilarity(options.getNameThreshold());
        this.storedNames = new AuthorKeyDeriver(options.getReferenceNameConvention());
        this.organizationMatcher = options.isEntityExtractionEnabled() && !options.getNormalizedVariants().isEmpty()
                ? new OrganizationMatcher(extractor, options.getEntityThreshold())
                : null;
        this.metrics = metrics;
        log.info("linkage.configured convention={} variants={} nameThreshold={} entityExtraction={}",
                options.getNameConvention(), options.getNormalizedVariants().size(), options.getNameThreshold(),
                organizationMatcher != null ? extractor.getProviderName() : "disabled");
    }

    /**
     * Reads the input CSV, links every author and writes the linkage file.
     */
    public LinkageReport run(Path inputCsv, Path output) {
        return run(inputCsv, output, CancellationToken.NONE);
    }

    public LinkageReport run(Path inputCsv, Path output, CancellationToken token) {
        LinkageInputReader.Inputs inputs = new LinkageInputReader(options).read(inputCsv);
        List<LinkageResult> results = linkAll(inputs.inputs(), token);
        try {
            LinkageResultCodec.write(output, results);
        } catch (IOException e) {
            throw new PipelineException(Stage.LINKAGE, null, "cannot write " + output + ": " + e.getMessage(), e);
        }
        LinkageReport report = LinkageReport.of(results, inputs.documentRefs(), output);
        log.info("linkage.completed output={} report={}", output, report);
        return report;
    }

    /**
     * Links the inputs without writing anything.
     */
    public LinkageReport link(List<LinkageInput> inputs) {
        Set<String> documentRefs = new LinkedHashSet<>();
        for (LinkageInput input : inputs) {
            if (!input.documentRef().isEmpty()) {
                documentRefs.add(input.documentRef());
            }
        }
        return LinkageReport.of(linkAll(inputs, CancellationToken.NONE), documentRefs, null);
    }

    private List<LinkageResult> linkAll(List<LinkageInput> inputs, CancellationToken token) {
        Instant start = Instant.now();
        List<LinkageResult> results = new ArrayList<>(inputs.size());
        Map<List<String>, LinkageResult> linked = new HashMap<>();
        try (LogContext ctx = LogContext.forStage(LogContext.generateRunId(), Stage.LINKAGE.label())) {
            for (LinkageInput input : inputs) {
                token.throwIfCancelled(Stage.LINKAGE, results.size());
                // a repeated (document, author) pair gets its own row with the first result
                LinkageResult result = linked.computeIfAbsent(
                        List.of(input.documentRef(), input.authorRef()), k -> link(input));
                metrics.incrementLinkage(result.status());
                results.add(result);
            }
        }
        metrics.recordStageDuration(Stage.LINKAGE, Duration.between(start, Instant.now()));
        return results;
    }

    /**
     * Links a single reference.
     */
    public LinkageResult link(LinkageInput input) {
        DocumentRows document = findDocument(input.documentRef());
        if (document == null) {
            log.debug("linkage.noDocument documentRef='{}'", input.documentRef());
            return LinkageResult.unmatched(input.documentRef(), input.authorRef(), LinkageStatus.UNMATCHED_NO_DOCUMENT);
        }

        ParsedName name = NameParser.parse(input.authorRef(), options.getNameConvention());
        Optional<AuthorMatch> exact = exactMatch(document, name);
        AuthorMatch author = exact.isPresent() ? exact.get() : fuzzyMatch(document, name).orElse(null);
        if (author == null) {
            log.debug("linkage.noAuthor documentId='{}' author='{}' key='{}'",
                    document.documentId(), input.authorRef(), name.key());
            return LinkageResult.unmatched(input.documentRef(), input.authorRef(), LinkageStatus.UNMATCHED_NO_AUTHOR);
        }

        List<StoreRecord> affiliations = document.rows().stream()
                .filter(author::isSameAuthor)
                .filter(r -> r.triple().hasAffiliation())
                .sorted(AffiliationDisambiguator.BY_AFFILIATION_SEQUENCE)
                .toList();
        if (affiliations.isEmpty()) {
            return LinkageResult.unmatched(input.documentRef(), input.authorRef(),
                    LinkageStatus.UNMATCHED_NO_AFFILIATION);
        }

        return decide(input, author, affiliations);
    }

    private LinkageResult decide(LinkageInput input, AuthorMatch author, List<StoreRecord> affiliations) {
        List<String> variants = options.getNormalizedVariants();
        AffiliationDisambiguator.Selection selection = disambiguator.select(affiliations, variants);

        StoreRecord chosen = selection.affiliation();
        LinkageStatus status = selection.status();
        MatchBasis basis = author.basis();
        boolean corroborated = false;
        double factor;

        switch (status) {
            case ORG_MATCH -> {
                factor = 1.0;
                if (organizationMatcher != null) {
                    corroborated = organizationMatcher
                            .bestMatch(chosen.triple().affiliationNameOriginal(), variants).isPresent();
                }
            }
            case FIRST_AVAILABLE -> factor = affiliations.size() == 1 ? 1.0 : SEVERAL_AFFILIATIONS_FACTOR;
            default -> {
                factor = NO_ORG_MATCH_FACTOR;
                if (organizationMatcher != null) {
                    for (StoreRecord affiliation : affiliations) {
                        Optional<OrganizationMatcher.Match> match = organizationMatcher
                                .bestMatch(affiliation.triple().affiliationNameOriginal(), variants);
                        if (match.isPresent()) {
                            chosen = affiliation;
                            status = LinkageStatus.ENTITY_MATCH;
                            basis = MatchBasis.ENTITY_EXTRACTION;
                            factor = match.get().score();
                            corroborated = true;
                            log.debug("linkage.entityMatch documentId='{}' candidate='{}' variant='{}' score={}",
                                    chosen.documentId(), match.get().candidate().text(), match.get().variant(),
                                    match.get().score());
                            break;
                        }
                    }
                }
            }
        }

        double confidence = author.nameScore() * factor;
        if (corroborated && status == LinkageStatus.ORG_MATCH) {
            confidence = Math.min(1.0, confidence + (1.0 - confidence) * 0.5);
        }

        return new LinkageResult(input.documentRef(), input.authorRef(), status, basis,
                chosen.documentId(), chosen.authorSequence(), chosen.triple().authorNameOriginal(),
                chosen.affiliationKey(), chosen.triple().affiliationNameOriginal(),
                chosen.triple().affiliationExternalRef(), confidence, corroborated);
    }

    private DocumentRows findDocument(String documentRef) {
        for (String form : options.getDocumentRefMode().lookupForms(documentRef)) {
            List<StoreRecord> rows = store.queryBy(StoreColumn.DOCUMENT_ID, form);
            if (!rows.isEmpty()) {
                return new DocumentRows(form, rows);
            }
        }
        return null;
    }

    private Optional<AuthorMatch> exactMatch(DocumentRows document, ParsedName name) {
        String key = name.key();
        if (key.isEmpty()) {
            return Optional.empty();
        }
        AuthorMatch best = null;
        for (StoreRecord row : store.queryBy(StoreColumn.AUTHOR_KEY, key)) {
            if (!row.documentId().equals(document.documentId())) {
                continue;
            }
            AuthorMatch candidate = AuthorMatch.of(row, MatchBasis.EXACT_NAME, 1.0);
            if (best == null || candidate.precedes(best)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<AuthorMatch> fuzzyMatch(DocumentRows document, ParsedName name) {
        if (name.isEmpty()) {
            return Optional.empty();
        }
        AuthorMatch best = null;
        for (StoreRecord row : document.rows()) {
            ParsedName stored = storedNames.parse(row.triple());
            double score = nameSimilarity.score(name, stored);
            if (score <= 0.0) {
                continue;
            }
            AuthorMatch candidate = AuthorMatch.of(row, MatchBasis.FUZZY_NAME, score);
            if (best == null || score > best.nameScore()
                    || (score == best.nameScore() && candidate.precedes(best))) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private record DocumentRows(String documentId, List<StoreRecord> rows) {}

    /**
     * The stored author a reference resolved to.
     */
    private record AuthorMatch(Integer authorSequence, String authorName, MatchBasis basis, double nameScore) {

        static AuthorMatch of(StoreRecord row, MatchBasis basis, double score) {
            return new AuthorMatch(row.authorSequence(), row.triple().authorNameOriginal(), basis, score);
        }

        boolean isSameAuthor(StoreRecord row) {
            return Objects.equals(authorSequence, row.authorSequence())
                    && (authorSequence != null || authorName.equals(row.triple().authorNameOriginal()));
        }

        /**
         * Lower author sequence first; authors without a sequence come last.
         */
        boolean precedes(AuthorMatch other) {
            if (authorSequence == null) {
                return false;
            }
            return other.authorSequence == null || authorSequence < other.authorSequence;
        }
    }
}
