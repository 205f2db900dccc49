package com.affiliation.linkage.extract;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.FlatRowCodec;
import com.affiliation.linkage.io.PartialFile;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes every row into one CSV file, in arrival order.
 */
public class SingleFileRowSink implements RowSink {
    private static final Logger log = LoggerFactory.getLogger(SingleFileRowSink.class);

    private final Path target;
    private final Path partial;
    private final CSVPrinter printer;
    private long rowsWritten;

    public SingleFileRowSink(Path target) throws IOException {
        this.target = target;
        this.partial = PartialFile.partialOf(target);
        this.printer = CsvTables.create(partial, FlatFieldRow.COLUMNS);
    }

    @Override
    public void write(List<FlatFieldRow> batch) throws IOException {
        for (FlatFieldRow row : batch) {
            FlatRowCodec.write(printer, row);
        }
        printer.flush();
        rowsWritten += batch.size();
    }

    @Override
    public void complete() throws IOException {
        printer.close(true);
        PartialFile.commit(partial, target);
        log.info("sink.completed file={} rows={}", target, rowsWritten);
    }

    @Override
    public void abort() {
        try {
            printer.close(true);
        } catch (IOException e) {
            log.warn("sink.abort.closeFailed file={} error={}", partial, e.getMessage());
        }
        log.warn("sink.aborted file={} rows={}", partial, rowsWritten);
    }

    public long getRowsWritten() {
        return rowsWritten;
    }
}
