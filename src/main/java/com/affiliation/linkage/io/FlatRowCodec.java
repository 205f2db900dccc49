package com.affiliation.linkage.io;

import com.affiliation.linkage.core.model.FlatFieldRow;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link FlatFieldRow} tables.
 */
public final class FlatRowCodec {

    private FlatRowCodec() {
        // Utility class
    }

    public static FlatFieldRow decode(List<String> values) {
        return new FlatFieldRow(values.get(0), values.get(1), values.get(2), values.get(3),
                values.get(4), values.get(5), values.get(6));
    }

    public static void write(CSVPrinter printer, FlatFieldRow row) throws IOException {
        printer.printRecord(row.toValues());
    }

    public static CsvRowReader<FlatFieldRow> reader(Path path) throws IOException {
        return new CsvRowReader<>(path, FlatFieldRow.COLUMNS, FlatRowCodec::decode);
    }
}
