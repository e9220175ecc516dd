package com.flagship.payments_engine.report;

import com.flagship.payments_engine.ledger.AccountSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportWriterTest {

    private final CsvReportWriter writer = new CsvReportWriter();

    @Test
    @DisplayName("Report has a header and four decimals on every amount")
    void writesReport() throws IOException {
        List<AccountSnapshot> accounts = List.of(
            new AccountSnapshot(1, new BigDecimal("1.5"), BigDecimal.ZERO, new BigDecimal("1.5"), false),
            new AccountSnapshot(2, new BigDecimal("2.0000"), new BigDecimal("0.1234"), new BigDecimal("2.1234"), true)
        );
        StringBuilder out = new StringBuilder();

        writer.write(accounts, out);

        assertEquals("""
            client,available,held,total,locked
            1,1.5000,0.0000,1.5000,false
            2,2.0000,0.1234,2.1234,true
            """, out.toString());
    }

    @Test
    @DisplayName("No accounts still produces the header")
    void emptyReport() throws IOException {
        StringBuilder out = new StringBuilder();

        writer.write(List.of(), out);

        assertEquals("client,available,held,total,locked\n", out.toString());
    }
}
