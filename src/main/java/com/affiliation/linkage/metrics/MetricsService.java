package com.affiliation.linkage.metrics;

import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.RejectionReason;
import com.affiliation.linkage.pipeline.Stage;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so stages can run without a registry.
 */
public interface MetricsService {

    void recordStageDuration(Stage stage, Duration duration);

    void incrementRecordsParsed(long count);

    void incrementParseErrors(long count);

    void incrementRowsEmitted(long count);

    void incrementSpillFiles(int count);

    void incrementRowsAccepted(long count);

    void incrementRowRejected(RejectionReason reason);

    void incrementLinkage(LinkageStatus status);

    void incrementDiscovered(long count);

    void recordCacheHit();

    void recordCacheMiss();
}
