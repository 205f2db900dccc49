package com.affiliation.linkage.metrics;

import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.RejectionReason;
import com.affiliation.linkage.pipeline.Stage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pipeline.stage.duration} (Timer, tag: stage)</li>
 *   <li>{@code extract.records.parsed}, {@code extract.parse.errors}, {@code extract.rows.emitted}</li>
 *   <li>{@code sort.spill.files}</li>
 *   <li>{@code load.rows.accepted}, {@code load.rows.rejected} (tag: reason)</li>
 *   <li>{@code linkage.results} (tag: status)</li>
 *   <li>{@code discovery.documents}</li>
 *   <li>{@code store.cache.hit}, {@code store.cache.miss}</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter recordsParsed;
    private final Counter parseErrors;
    private final Counter rowsEmitted;
    private final Counter spillFiles;
    private final Counter rowsAccepted;
    private final Counter discovered;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.recordsParsed = counter("extract.records.parsed", "Input records parsed");
        this.parseErrors = counter("extract.parse.errors", "Input records skipped as unparsable");
        this.rowsEmitted = counter("extract.rows.emitted", "Flat field rows written");
        this.spillFiles = counter("sort.spill.files", "Sorted chunks spilled to disk");
        this.rowsAccepted = counter("load.rows.accepted", "Rows accepted by the store");
        this.discovered = counter("discovery.documents", "Distinct documents discovered");
        this.cacheHits = counter("store.cache.hit", "Store lookup cache hits");
        this.cacheMisses = counter("store.cache.miss", "Store lookup cache misses");
    }

    @Override
    public void recordStageDuration(Stage stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage.label(), k ->
                Timer.builder("pipeline.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage.label())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRecordsParsed(long count) {
        recordsParsed.increment(count);
    }

    @Override
    public void incrementParseErrors(long count) {
        parseErrors.increment(count);
    }

    @Override
    public void incrementRowsEmitted(long count) {
        rowsEmitted.increment(count);
    }

    @Override
    public void incrementSpillFiles(int count) {
        spillFiles.increment(count);
    }

    @Override
    public void incrementRowsAccepted(long count) {
        rowsAccepted.increment(count);
    }

    @Override
    public void incrementRowRejected(RejectionReason reason) {
        Counter counter = counterCache.computeIfAbsent("rejected:" + reason.name(), k ->
                Counter.builder("load.rows.rejected")
                        .description("Rows diverted to the load error log")
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementLinkage(LinkageStatus status) {
        Counter counter = counterCache.computeIfAbsent("linkage:" + status.name(), k ->
                Counter.builder("linkage.results")
                        .description("Linkage results by status")
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementDiscovered(long count) {
        discovered.increment(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }
}
