package com.flagship.transaction_replay.ingestion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_replay.ledger.Amount;
import com.flagship.transaction_replay.transaction.TransactionRecord;
import com.flagship.transaction_replay.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Opens CSV files of transaction rows.
 *
 * Expected header: {@code type, client, tx, amount}. Fields may be padded with
 * whitespace and rows may omit trailing columns; a missing amount reads as zero.
 * Files are read as raw bytes so Jackson detects the encoding and drops a
 * leading byte order mark.
 *
 * Decoding rules:
 * - type must be one of the lowercase codes of {@link TransactionType}
 * - client must fit an unsigned 16-bit value, tx an unsigned 32-bit value
 * - amount is parsed leniently (garbage reads as zero) unless strict amounts are on
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvTransactionReader {

    static final String TYPE_COLUMN = "type";
    static final String CLIENT_COLUMN = "client";
    static final String TX_COLUMN = "tx";
    static final String AMOUNT_COLUMN = "amount";

    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {
    };

    private final CsvMapper csvMapper;
    private final IngestionSettings settings;

    /**
     * Opens the file at {@code source} and reads its header.
     *
     * @throws IOException if the file cannot be opened or has no readable header
     */
    public TransactionSource open(String source) throws IOException {
        Path path;
        try {
            path = Path.of(source);
        } catch (InvalidPathException e) {
            throw new IOException("Invalid input path: " + source, e);
        }

        InputStream input = Files.newInputStream(path);
        try {
            MappingIterator<Map<String, String>> rows = csvMapper.readerFor(ROW_TYPE)
                    .with(CsvSchema.emptySchema().withHeader())
                    .readValues(input);
            return new CsvTransactionSource(source, rows);
        } catch (IOException | RuntimeException e) {
            input.close();
            throw e;
        }
    }

    TransactionRecord decode(String source, long row, Map<String, String> fields) {
        String typeCode = field(fields, TYPE_COLUMN);
        TransactionType type = TransactionType.fromCode(typeCode)
                .orElseThrow(() -> new MalformedRecordException(source, row,
                        "Unrecognized transaction type: '" + typeCode + "'"));

        int clientId = (int) parseId(source, row, fields, CLIENT_COLUMN, TransactionRecord.MAX_CLIENT_ID);
        long txId = parseId(source, row, fields, TX_COLUMN, TransactionRecord.MAX_TX_ID);
        Amount amount = parseAmount(source, row, field(fields, AMOUNT_COLUMN));

        return TransactionRecord.of(type, clientId, txId, amount);
    }

    private long parseId(String source, long row, Map<String, String> fields, String column, long max) {
        String text = field(fields, column);
        if (text == null || text.isEmpty()) {
            throw new MalformedRecordException(source, row, "Missing " + column);
        }
        try {
            long value = Long.parseLong(text);
            if (value < 0 || value > max) {
                throw new MalformedRecordException(source, row,
                        String.format("%s %d out of range [0, %d]", column, value, max));
            }
            return value;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source, row, "Invalid " + column + ": '" + text + "'", e);
        }
    }

    private Amount parseAmount(String source, long row, String text) {
        if (text == null || text.isEmpty()) {
            return Amount.ZERO;
        }
        try {
            return Amount.parse(text);
        } catch (NumberFormatException | ArithmeticException e) {
            if (settings.isStrictAmounts()) {
                throw new MalformedRecordException(source, row, "Invalid amount: '" + text + "'", e);
            }
            log.warn("{} row {}: unparseable amount '{}' read as zero", source, row, text);
            return Amount.ZERO;
        }
    }

    private static String field(Map<String, String> fields, String column) {
        String value = fields.get(column);
        return value != null ? value.trim() : null;
    }

    private static Map<String, String> normalizeKeys(Map<String, String> row) {
        Map<String, String> normalized = new HashMap<>(row.size());
        row.forEach((key, value) -> normalized.put(key.trim(), value));
        return normalized;
    }

    private final class CsvTransactionSource implements TransactionSource {

        private final String name;
        private final MappingIterator<Map<String, String>> rows;
        private long row;

        private CsvTransactionSource(String name, MappingIterator<Map<String, String>> rows) {
            this.name = name;
            this.rows = rows;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Optional<TransactionRecord> next() throws IOException {
            if (!rows.hasNextValue()) {
                return Optional.empty();
            }
            Map<String, String> fields = normalizeKeys(rows.nextValue());
            row++;
            return Optional.of(decode(name, row, fields));
        }

        @Override
        public void close() throws IOException {
            rows.close();
        }
    }
}
