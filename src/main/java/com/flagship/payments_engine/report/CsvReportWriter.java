package com.flagship.payments_engine.report;

import com.flagship.payments_engine.ledger.AccountSnapshot;
import com.flagship.payments_engine.ledger.Amounts;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Writes the final account report as CSV.
 *
 * <pre>
 * client,available,held,total,locked
 * 1,1.5000,0.0000,1.5000,false
 * </pre>
 * Rows are written in the order given; amounts always carry four decimals.
 */
@Component
public class CsvReportWriter {

    private static final CSVFormat FORMAT = CSVFormat.Builder.create(CSVFormat.DEFAULT)
            .setHeader("client", "available", "held", "total", "locked")
            .setRecordSeparator("\n")
            .build();

    public void write(List<AccountSnapshot> accounts, Appendable out) throws IOException {
        // Not closed: the caller owns the output.
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        for (AccountSnapshot account : accounts) {
            printer.printRecord(
                account.getClientId(),
                Amounts.format(account.getAvailable()),
                Amounts.format(account.getHeld()),
                Amounts.format(account.getTotal()),
                account.isLocked()
            );
        }
        printer.flush();
    }
}
