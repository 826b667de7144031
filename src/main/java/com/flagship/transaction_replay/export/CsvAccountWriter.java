package com.flagship.transaction_replay.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_replay.ledger.AccountSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;

/**
 * Writes accounts as CSV with the header {@code client,available,held,total,locked}.
 *
 * Amounts are rendered with four fractional digits, locked as true/false.
 */
@Component
@RequiredArgsConstructor
public class CsvAccountWriter implements AccountWriter {

    private final CsvMapper csvMapper;

    @Override
    public void write(List<AccountSnapshot> accounts, OutputStream out) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(AccountRow.class).withHeader();

        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(out)) {
            for (AccountSnapshot account : accounts) {
                rows.write(AccountRow.from(account));
            }
        }
        out.flush();

        // PrintStream reports write failures through a flag instead of throwing
        if (out instanceof PrintStream && ((PrintStream) out).checkError()) {
            throw new IOException("Failed to write accounts to output stream");
        }
    }

    @Value
    @JsonPropertyOrder({"client", "available", "held", "total", "locked"})
    static class AccountRow {
        int client;
        BigDecimal available;
        BigDecimal held;
        BigDecimal total;
        boolean locked;

        static AccountRow from(AccountSnapshot snapshot) {
            return new AccountRow(
                    snapshot.getClientId(),
                    snapshot.getAvailable().toBigDecimal(),
                    snapshot.getHeld().toBigDecimal(),
                    snapshot.getTotal().toBigDecimal(),
                    snapshot.isLocked()
            );
        }
    }
}
