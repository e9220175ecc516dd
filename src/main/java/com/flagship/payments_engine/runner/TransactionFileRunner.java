package com.flagship.payments_engine.runner;

import com.flagship.payments_engine.dispatch.TransactionDispatcher;
import com.flagship.payments_engine.ingest.CsvTransactionReader;
import com.flagship.payments_engine.ledger.LedgerEngine;
import com.flagship.payments_engine.ledger.TransactionRecord;
import com.flagship.payments_engine.report.CsvReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Command line entry point: reads a CSV file of transactions, applies every
 * record, and writes the account report to stdout.
 *
 * Usage: {@code payments-engine transactions.csv > accounts.csv}
 *
 * Exit codes:
 * - 0: report written
 * - 1: missing argument, unreadable input, or a fatal ledger error
 */
@Component
@ConditionalOnProperty(name = "engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TransactionFileRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String PROGRAM_NAME = "payments-engine";

    private final CsvTransactionReader reader;
    private final TransactionDispatcher dispatcher;
    private final LedgerEngine engine;
    private final CsvReportWriter reportWriter;
    private final boolean consumerEnabled;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    @Autowired
    public TransactionFileRunner(CsvTransactionReader reader,
                                 TransactionDispatcher dispatcher,
                                 LedgerEngine engine,
                                 CsvReportWriter reportWriter,
                                 @Value("${consumer.enabled:false}") boolean consumerEnabled) {
        this(reader, dispatcher, engine, reportWriter, consumerEnabled, System.out, System.err);
    }

    TransactionFileRunner(CsvTransactionReader reader,
                          TransactionDispatcher dispatcher,
                          LedgerEngine engine,
                          CsvReportWriter reportWriter,
                          boolean consumerEnabled,
                          PrintStream out,
                          PrintStream err) {
        this.reader = reader;
        this.dispatcher = dispatcher;
        this.engine = engine;
        this.reportWriter = reportWriter;
        this.consumerEnabled = consumerEnabled;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();

        if (files.isEmpty() && consumerEnabled) {
            log.info("No input file given, consuming transactions from Kafka");
            return;
        }
        if (!files.isEmpty() && consumerEnabled) {
            err.println("An input file cannot be combined with consumer.enabled=true");
            exitCode = 1;
            return;
        }
        if (files.size() != 1) {
            err.println("Usage: ");
            err.println("\t" + PROGRAM_NAME + " transactions.csv");
            exitCode = 1;
            return;
        }

        Path input = Path.of(files.get(0));
        try {
            long submitted = process(input);
            reportWriter.write(engine.snapshot(), out);
            out.flush();
            log.info("Processed {} records from {}", submitted, input);
        } catch (IOException e) {
            log.error("Failed to process {}: {}", input, e.getMessage(), e);
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Aborting run on {}: {}", input, e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private long process(Path input) throws IOException {
        long submitted = 0;
        try (Stream<TransactionRecord> records = reader.read(input)) {
            for (TransactionRecord record : (Iterable<TransactionRecord>) records::iterator) {
                dispatcher.submit(record);
                submitted++;
            }
        } finally {
            dispatcher.awaitCompletion();
        }
        return submitted;
    }
}
