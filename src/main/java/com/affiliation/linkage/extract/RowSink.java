package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;

import java.io.IOException;
import java.util.List;

/**
 * Destination for extracted rows. Implementations are single-writer; the extractor
 * serializes calls from its workers.
 */
public interface RowSink {

    /**
     * Writes one batch of rows.
     */
    void write(List<FlatFieldRow> batch) throws IOException;

    /**
     * Flushes and closes all outputs and gives them their final names.
     */
    void complete() throws IOException;

    /**
     * Closes all outputs, leaving them marked incomplete.
     */
    void abort();
}
