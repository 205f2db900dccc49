package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.ErrorRecord;
import com.affiliation.linkage.io.CsvTables;
import com.affiliation.linkage.io.PartialFile;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rejected rows to a CSV side file ({@code line_number, reason, message, raw_row}).
 * The raw row is kept as a single CSV-encoded cell so it can be re-parsed verbatim.
 */
public class ErrorLogWriter implements AutoCloseable {

    public static final List<String> COLUMNS = List.of("line_number", "reason", "message", "raw_row");

    private final Path target;
    private final Path partial;
    private final CSVPrinter printer;
    private long written;
    private boolean closed;

    public ErrorLogWriter(Path target) throws IOException {
        this.target = target;
        this.partial = PartialFile.partialOf(target);
        this.printer = CsvTables.create(partial, COLUMNS);
    }

    public void write(ErrorRecord error) throws IOException {
        printer.printRecord(error.lineNumber(), error.reason().name(), error.message(),
                CSVFormat.DEFAULT.format(error.rawRow().toArray()));
        written++;
    }

    public long getWritten() {
        return written;
    }

    /**
     * Flushes and renames the log to its final name.
     */
    public void commit() throws IOException {
        close();
        PartialFile.commit(partial, target);
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            printer.close(true);
        }
    }
}
