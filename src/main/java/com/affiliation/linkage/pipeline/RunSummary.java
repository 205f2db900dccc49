package com.affiliation.linkage.pipeline;

import com.affiliation.linkage.discovery.DiscoveryReport;
import com.affiliation.linkage.extract.ExtractionResult;
import com.affiliation.linkage.join.JoinResult;
import com.affiliation.linkage.linkage.LinkageReport;
import com.affiliation.linkage.sort.SortResult;
import com.affiliation.linkage.store.LoadResult;

/**
 * Outcome of a chained pipeline run. Stages that did not run are null.
 *
 * @param runId      identifier of the run, also present in the log MDC
 * @param extraction extraction result
 * @param sort       sort result
 * @param join       join result
 * @param load       store load result
 * @param linkage    linkage report
 * @param discovery  discovery report
 * @param failure    the fatal error that stopped the run, or null
 */
public record RunSummary(
        String runId,
        ExtractionResult extraction,
        SortResult sort,
        JoinResult join,
        LoadResult load,
        LinkageReport linkage,
        DiscoveryReport discovery,
        PipelineException failure
) {

    public long accepted() {
        return load != null ? load.accepted() : 0;
    }

    public long rejected() {
        return load != null ? load.rejected() : 0;
    }

    /**
     * Unmatched linkage inputs plus discovery inputs that led nowhere.
     */
    public long unmatched() {
        long linkageUnmatched = linkage != null ? linkage.unmatched() : 0;
        long discoveryUnmatched = discovery != null ? discovery.unmatched().size() : 0;
        return linkageUnmatched + discoveryUnmatched;
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    /**
     * Process exit status: 0 unless a fatal error stopped the run. Rejected or unmatched rows never fail a run.
     */
    public int exitCode() {
        return failure == null ? 0 : 1;
    }

    @Override
    public String toString() {
        return "RunSummary{runId=" + runId +
                ", accepted=" + accepted() +
                ", rejected=" + rejected() +
                ", unmatched=" + unmatched() +
                ", failedStage=" + (failure != null ? failure.getStage().label() : "none") + '}';
    }
}
