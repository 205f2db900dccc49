package com.affiliation.linkage.metrics;

import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.RejectionReason;
import com.affiliation.linkage.pipeline.Stage;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(Stage stage, Duration duration) {
    }

    @Override
    public void incrementRecordsParsed(long count) {
    }

    @Override
    public void incrementParseErrors(long count) {
    }

    @Override
    public void incrementRowsEmitted(long count) {
    }

    @Override
    public void incrementSpillFiles(int count) {
    }

    @Override
    public void incrementRowsAccepted(long count) {
    }

    @Override
    public void incrementRowRejected(RejectionReason reason) {
    }

    @Override
    public void incrementLinkage(LinkageStatus status) {
    }

    @Override
    public void incrementDiscovered(long count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
