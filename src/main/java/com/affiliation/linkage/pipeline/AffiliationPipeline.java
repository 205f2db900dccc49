package com.affiliation.linkage.pipeline;

import com.affiliation.linkage.cache.CachingIndexedStore;
import com.affiliation.linkage.config.PipelineConfig;
import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.discovery.DiscoveryEngine;
import com.affiliation.linkage.discovery.DiscoveryReport;
import com.affiliation.linkage.discovery.DiscoverySeeds;
import com.affiliation.linkage.discovery.DiscoveryWriter;
import com.affiliation.linkage.discovery.SeedSet;
import com.affiliation.linkage.entity.EntityExtractor;
import com.affiliation.linkage.entity.NoOpEntityExtractor;
import com.affiliation.linkage.entity.OllamaEntityExtractor;
import com.affiliation.linkage.entity.OrganizationMatcher;
import com.affiliation.linkage.extract.ExtractionOptions;
import com.affiliation.linkage.extract.ExtractionResult;
import com.affiliation.linkage.extract.FieldExtractor;
import com.affiliation.linkage.extract.OrganizedRowSink;
import com.affiliation.linkage.extract.RowSink;
import com.affiliation.linkage.extract.SingleFileRowSink;
import com.affiliation.linkage.graph.FalkorDBConnection;
import com.affiliation.linkage.graph.GraphIndexedStore;
import com.affiliation.linkage.io.LinkageResultCodec;
import com.affiliation.linkage.join.JoinNormalizer;
import com.affiliation.linkage.join.JoinResult;
import com.affiliation.linkage.linkage.LinkageEngine;
import com.affiliation.linkage.linkage.LinkageOptions;
import com.affiliation.linkage.linkage.LinkageReport;
import com.affiliation.linkage.logging.LogContext;
import com.affiliation.linkage.metrics.MetricsService;
import com.affiliation.linkage.metrics.NoOpMetricsService;
import com.affiliation.linkage.rules.AffiliationKeyDeriver;
import com.affiliation.linkage.sort.ExternalSorter;
import com.affiliation.linkage.sort.SortResult;
import com.affiliation.linkage.store.InMemoryIndexedStore;
import com.affiliation.linkage.store.IndexedStore;
import com.affiliation.linkage.store.LoadResult;
import com.affiliation.linkage.store.StoreLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Wires the pipeline stages from a {@link PipelineConfig}.
 *
 * <p>Each stage can be run on its own, reading only the previous stage's file, or the stages
 * can be chained. Chained runs write their intermediates into a work directory:</p>
 * <pre>
 * flat_rows.csv -> sorted_rows.csv -> triples.csv -> (store) + load_errors.csv
 * &lt;prefix&gt;_linkage.csv, &lt;prefix&gt;_full_discovery_log.csv, &lt;prefix&gt;_discovered_works.csv, &lt;prefix&gt;_unmatched.csv
 * </pre>
 *
 * Usage:
 * <pre>
 * try (AffiliationPipeline pipeline = AffiliationPipeline.builder()
 *         .config(ConfigLoader.load(Path.of("pipeline.yml")))
 *         .build()) {
 *     RunSummary summary = pipeline.runAll(corpusDir, workDir, linkageInput);
 *     System.exit(summary.exitCode());
 * }
 * </pre>
 */
public class AffiliationPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AffiliationPipeline.class);

    public static final String FLAT_ROWS = "flat_rows.csv";
    public static final String SORTED_ROWS = "sorted_rows.csv";
    public static final String TRIPLES = "triples.csv";
    public static final String LOAD_ERRORS = "load_errors.csv";
    public static final String LINKAGE_SUFFIX = "_linkage.csv";

    private final PipelineConfig config;
    private final IndexedStore store;
    private final EntityExtractor entityExtractor;
    private final MetricsService metrics;
    private final CancellationToken token;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AffiliationKeyDeriver affiliationKeys = new AffiliationKeyDeriver();

    private AffiliationPipeline(Builder builder) {
        this.config = builder.config != null ? builder.config : PipelineConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.token = builder.token != null ? builder.token : CancellationToken.NONE;
        IndexedStore base = builder.store != null ? builder.store : openStore(config);
        this.store = config.cache().enabled()
                ? new CachingIndexedStore(base, config.cache().createCache(), metrics)
                : base;
        this.entityExtractor = builder.entityExtractor != null ? builder.entityExtractor : createExtractor(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Extracts the corpus into one flat-row file, or into one file per grouping key 1 under
     * {@code output} when organize mode is configured.
     */
    public ExtractionResult extract(Path corpusDir, Path output) {
        return extract(corpusDir, output, config.extraction().organize());
    }

    private ExtractionResult extract(Path corpusDir, Path output, boolean organize) {
        ExtractionOptions options = config.extraction().toOptions();
        RowSink sink;
        try {
            sink = organize ? new OrganizedRowSink(output, options.getMaxOpenFiles()) : new SingleFileRowSink(output);
        } catch (IOException e) {
            throw new ResourceExhaustedException(Stage.EXTRACT, "cannot open output " + output, e);
        }
        return new FieldExtractor(options, objectMapper, metrics).extract(corpusDir, sink, token, ProgressCallback.NOOP);
    }

    public SortResult sort(Path flatRows, Path sortedOutput) {
        return new ExternalSorter(config.sort().toOptions(), metrics).sort(flatRows, sortedOutput, token);
    }

    public JoinResult join(Path sortedRows, Path triplesOutput) {
        return new JoinNormalizer(config.join().toFieldRoles(), metrics).join(sortedRows, triplesOutput, token);
    }

    public LoadResult load(Path triples, Path errorLog) {
        return new StoreLoader(store, config.store().toOptions(), affiliationKeys, metrics)
                .load(triples, errorLog, token, ProgressCallback.NOOP);
    }

    public LinkageReport link(Path inputCsv, Path linkageOutput) {
        return linkageEngine().run(inputCsv, linkageOutput, token);
    }

    /**
     * Discovers documents sharing the affiliations matched by a linkage run.
     */
    public DiscoveryReport discoverFromLinkage(LinkageReport linkage, Path outputDir) {
        SeedSet seeds = DiscoverySeeds.fromLinkage(linkage.results(), linkage.inputDocumentRefs(),
                linkageOptions().getDocumentRefMode());
        return discover(withEntitySeeds(seeds, linkage.results()), outputDir);
    }

    /**
     * Same as {@link #discoverFromLinkage(LinkageReport, Path)} for a linkage file written by an earlier run.
     */
    public DiscoveryReport discoverFromLinkageFile(Path linkageCsv, Path outputDir) {
        List<LinkageResult> results;
        try {
            results = LinkageResultCodec.read(linkageCsv);
        } catch (IOException e) {
            throw new PipelineException(Stage.DISCOVERY, null, "cannot read " + linkageCsv + ": " + e.getMessage(), e);
        }
        SeedSet seeds = DiscoverySeeds.fromLinkage(results, List.of(), linkageOptions().getDocumentRefMode());
        return discover(withEntitySeeds(seeds, results), outputDir);
    }

    public DiscoveryReport discoverFromAffiliations(Collection<String> affiliationNames, Path outputDir) {
        return discover(DiscoverySeeds.fromAffiliationNames(affiliationNames, affiliationKeys), outputDir);
    }

    public DiscoveryReport discoverFromDocuments(Collection<String> documentIds, Path outputDir) {
        List<String> variants = config.discovery().restrictToVariants() ? linkageOptions().getNormalizedVariants() : List.of();
        return discover(DiscoverySeeds.fromDocumentIds(store, documentIds, variants), outputDir);
    }

    /**
     * Builds the store from a corpus: extract, sort, join and load.
     */
    public RunSummary runBuild(Path corpusDir, Path workDir) {
        return run(corpusDir, workDir, null);
    }

    /**
     * Builds the store, links the input file and runs discovery from the linkage results.
     */
    public RunSummary runAll(Path corpusDir, Path workDir, Path linkageInput) {
        return run(corpusDir, workDir, linkageInput);
    }

    private RunSummary run(Path corpusDir, Path workDir, Path linkageInput) {
        String runId = LogContext.generateRunId();
        ExtractionResult extraction = null;
        SortResult sortResult = null;
        JoinResult joinResult = null;
        LoadResult loadResult = null;
        LinkageReport linkage = null;
        DiscoveryReport discovery = null;
        PipelineException failure = null;

        try (LogContext ctx = LogContext.forStage(runId, "pipeline")) {
            log.info("pipeline.started corpus={} workDir={} linkageInput={}", corpusDir, workDir, linkageInput);
            try {
                createDirectories(workDir);
                extraction = extract(corpusDir, workDir.resolve(FLAT_ROWS), false);
                sortResult = sort(workDir.resolve(FLAT_ROWS), workDir.resolve(SORTED_ROWS));
                joinResult = join(workDir.resolve(SORTED_ROWS), workDir.resolve(TRIPLES));
                loadResult = load(workDir.resolve(TRIPLES), workDir.resolve(LOAD_ERRORS));
                if (linkageInput != null) {
                    String prefix = config.discovery().outputPrefix();
                    linkage = link(linkageInput, workDir.resolve(prefix + LINKAGE_SUFFIX));
                    discovery = discoverFromLinkage(linkage, workDir);
                }
            } catch (PipelineException e) {
                failure = e;
                log.error("pipeline.failed stage={} records={} error={}",
                        e.getStage().label(), e.getRecordRange(), e.getMessage(), e);
            }
            RunSummary summary = new RunSummary(runId, extraction, sortResult, joinResult, loadResult,
                    linkage, discovery, failure);
            log.info("pipeline.completed summary={}", summary);
            return summary;
        }
    }

    public IndexedStore getStore() {
        return store;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        store.close();
    }

    private DiscoveryReport discover(SeedSet seeds, Path outputDir) {
        DiscoveryReport report = new DiscoveryEngine(store, metrics).discover(seeds, token);
        try {
            createDirectories(outputDir);
            new DiscoveryWriter(outputDir, config.discovery().outputPrefix()).write(report);
        } catch (IOException e) {
            throw new PipelineException(Stage.DISCOVERY, null, "cannot write discovery output: " + e.getMessage(), e);
        }
        return report;
    }

    private SeedSet withEntitySeeds(SeedSet seeds, List<LinkageResult> results) {
        LinkageOptions options = linkageOptions();
        if (!config.discovery().useEntities() || options.getNormalizedVariants().isEmpty()) {
            return seeds;
        }
        OrganizationMatcher matcher = new OrganizationMatcher(entityExtractor, options.getEntityThreshold());
        return DiscoverySeeds.combine(seeds,
                DiscoverySeeds.fromEntities(results, matcher, options.getNormalizedVariants(), affiliationKeys));
    }

    private LinkageEngine linkageEngine() {
        return new LinkageEngine(store, linkageOptions(), entityExtractor, metrics);
    }

    private LinkageOptions linkageOptions() {
        return config.linkage().toOptions(config.store().referenceConvention());
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ResourceExhaustedException(Stage.EXTRACT, "cannot create directory " + dir, e);
        }
    }

    private static IndexedStore openStore(PipelineConfig config) {
        if (config.store().isGraphBackend()) {
            return new GraphIndexedStore(new FalkorDBConnection(
                    config.store().host(), config.store().port(), config.store().graphName()));
        }
        return new InMemoryIndexedStore();
    }

    private static EntityExtractor createExtractor(PipelineConfig config) {
        String url = config.linkage().ollamaUrl();
        if (!config.linkage().isEntityExtractionEnabled() || url == null || url.isBlank()) {
            return new NoOpEntityExtractor();
        }
        OllamaEntityExtractor.Builder builder = OllamaEntityExtractor.builder().baseUrl(url);
        if (config.linkage().ollamaModel() != null) {
            builder.model(config.linkage().ollamaModel());
        }
        return builder.build();
    }

    public static class Builder {
        private PipelineConfig config;
        private IndexedStore store;
        private EntityExtractor entityExtractor;
        private MetricsService metrics;
        private CancellationToken token;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Uses the given store instead of the one described by the configuration.
         */
        public Builder store(IndexedStore store) {
            this.store = store;
            return this;
        }

        public Builder entityExtractor(EntityExtractor entityExtractor) {
            this.entityExtractor = entityExtractor;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder cancellationToken(CancellationToken token) {
            this.token = token;
            return this;
        }

        public AffiliationPipeline build() {
            return new AffiliationPipeline(this);
        }
    }
}
