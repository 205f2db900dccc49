package com.affiliation.linkage.pipeline;

import com.affiliation.linkage.core.model.LinkageResult;
import com.affiliation.linkage.core.model.LinkageStatus;
import com.affiliation.linkage.core.model.RejectionReason;
import com.affiliation.linkage.discovery.DiscoveryReport;
import com.affiliation.linkage.discovery.SeedSource;
import com.affiliation.linkage.discovery.UnmatchedInput;
import com.affiliation.linkage.linkage.LinkageReport;
import com.affiliation.linkage.store.LoadResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunSummary Tests")
class RunSummaryTest {

    private final LoadResult load = new LoadResult(10, 8, 2,
            Map.of(RejectionReason.MISSING_AUTHOR_NAME, 2L), Path.of("load_errors.csv"));
    private final LinkageReport linkage = LinkageReport.of(List.of(
            LinkageResult.unmatched("W9", "Nobody", LinkageStatus.UNMATCHED_NO_DOCUMENT)), Set.of("W9"), null);
    private final DiscoveryReport discovery = new DiscoveryReport(0, 0, List.of(), List.of(),
            List.of(new UnmatchedInput("W9", SeedSource.DOCUMENT_ID, "document not found in store")), 0);

    @Test
    @DisplayName("Rejected and unmatched rows do not fail a run")
    void successfulRunExitsZero() {
        RunSummary summary = new RunSummary("run", null, null, null, load, linkage, discovery, null);

        assertTrue(summary.isSuccessful());
        assertEquals(0, summary.exitCode());
        assertEquals(8, summary.accepted());
        assertEquals(2, summary.rejected());
        assertEquals(2, summary.unmatched());
        assertTrue(summary.toString().contains("failedStage=none"));
    }

    @Test
    @DisplayName("A fatal error gives a non-zero exit code")
    void failedRunExitsNonZero() {
        RunSummary summary = new RunSummary("run", null, null, null, null, null, null,
                new PipelineException(Stage.SORT, "1-100", "row order violated"));

        assertFalse(summary.isSuccessful());
        assertEquals(1, summary.exitCode());
        assertEquals(0, summary.accepted());
        assertEquals(0, summary.unmatched());
        assertTrue(summary.toString().contains("failedStage=sort"));
    }
}
