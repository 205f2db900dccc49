package com.affiliation.linkage.io;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Streams typed rows out of a CSV file with a known header.
 * A row with the wrong number of columns raises {@link MalformedRowException}
 * for that row only; iteration can continue afterwards.
 *
 * @param <T> the decoded row type
 */
public class CsvRowReader<T> implements Iterator<T>, AutoCloseable {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> columns;
    private final Function<List<String>, T> decoder;
    private long lastRecordNumber;

    public CsvRowReader(Path path, List<String> columns, Function<List<String>, T> decoder) throws IOException {
        this.parser = CsvTables.open(path);
        this.columns = columns;
        this.decoder = decoder;
        List<String> header = parser.getHeaderNames();
        if (!header.equals(columns)) {
            parser.close();
            throw new MalformedRowException(0, "unexpected header " + header + " in " + path
                    + ", expected " + columns);
        }
        this.records = parser.iterator();
    }

    @Override
    public boolean hasNext() {
        return records.hasNext();
    }

    /**
     * Returns the next decoded row.
     *
     * @throws MalformedRowException if the row has the wrong shape
     * @throws UncheckedIOException  if the underlying file cannot be read
     */
    @Override
    public T next() {
        if (!records.hasNext()) {
            throw new NoSuchElementException();
        }
        CSVRecord record = records.next();
        lastRecordNumber = record.getRecordNumber();
        if (record.size() != columns.size()) {
            throw new MalformedRowException(lastRecordNumber,
                    "expected " + columns.size() + " columns but found " + record.size());
        }
        return decoder.apply(record.toList());
    }

    /**
     * Returns the 1-based number of the last record returned (header excluded).
     */
    public long lastRecordNumber() {
        return lastRecordNumber;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
