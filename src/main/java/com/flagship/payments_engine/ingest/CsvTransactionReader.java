package com.flagship.payments_engine.ingest;

import com.flagship.payments_engine.ledger.TransactionRecord;
import com.flagship.payments_engine.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Streams transaction records from a CSV source.
 *
 * Expected format:
 * <pre>
 * type,       client, tx, amount
 * deposit,         1,  1,    1.0
 * dispute,         1,  1,
 * </pre>
 * Surrounding whitespace is ignored, the header is matched ignoring case and a
 * missing trailing amount column is accepted. Rows are parsed lazily as the
 * stream is consumed. Malformed rows are logged, counted and skipped.
 *
 * The returned stream owns the underlying reader and must be closed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CsvTransactionReader {

    static final String TYPE = "type";
    static final String CLIENT = "client";
    static final String TX = "tx";
    static final String AMOUNT = "amount";

    private static final List<String> REQUIRED_COLUMNS = List.of(TYPE, CLIENT, TX);
    private static final String METRICS_SOURCE = "csv";

    private static final CSVFormat FORMAT = CSVFormat.Builder.create(CSVFormat.DEFAULT)
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final TransactionRecordParser parser;
    private final LedgerMetrics metrics;

    public Stream<TransactionRecord> read(Path path) throws IOException {
        return read(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IOException if the source cannot be read or lacks a required column
     */
    public Stream<TransactionRecord> read(Reader reader) throws IOException {
        CSVParser csv;
        try {
            csv = FORMAT.parse(reader);
            requireColumns(csv);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }

        return csv.stream()
                .map(this::toRecord)
                .flatMap(Optional::stream)
                .onClose(() -> close(csv));
    }

    private void requireColumns(CSVParser csv) throws IOException {
        List<String> header = csv.getHeaderNames().stream()
                .map(String::toLowerCase)
                .toList();
        for (String column : REQUIRED_COLUMNS) {
            if (!header.contains(column)) {
                csv.close();
                throw new IOException("CSV header is missing required column '" + column + "', found " + header);
            }
        }
    }

    private Optional<TransactionRecord> toRecord(CSVRecord row) {
        String source = "record " + row.getRecordNumber();
        try {
            return Optional.of(parser.parse(source,
                    field(row, TYPE), field(row, CLIENT), field(row, TX), field(row, AMOUNT)));
        } catch (MalformedRecordException e) {
            metrics.recordMalformed(METRICS_SOURCE);
            log.warn("Skipping malformed {}: {}", e.getSource(), e.getMessage());
            return Optional.empty();
        }
    }

    private String field(CSVRecord row, String name) {
        return row.isMapped(name) && row.isSet(name) ? row.get(name) : null;
    }

    private void close(CSVParser csv) {
        try {
            csv.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close CSV source", e);
        }
    }
}
