package com.flagship.transaction_replay.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flagship.transaction_replay.export.AccountWriter;
import com.flagship.transaction_replay.ledger.AccountSnapshot;
import com.flagship.transaction_replay.ledger.Ledger;
import com.flagship.transaction_replay.observability.IngestionContext;
import com.flagship.transaction_replay.observability.LedgerMetrics;
import com.flagship.transaction_replay.transaction.TransactionProcessor;
import com.flagship.transaction_replay.transaction.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Feeds input streams through the {@link TransactionProcessor} into a shared {@link Ledger}.
 *
 * Each stream gets its own worker on a thread pool. A worker reads its stream
 * lazily and applies records strictly in order, so records from the same stream
 * keep their relative order. Records from different streams interleave freely.
 *
 * Failure handling:
 * - A stream that cannot be opened ends its worker, nothing is applied
 * - A malformed row ends its worker under the ABORT policy, or is skipped under SKIP
 * - A CSV syntax error (e.g. an unclosed quote) always ends its worker, whatever the
 *   policy, since the parser cannot find where the next row starts
 * - A read error mid-stream ends its worker
 * - None of these affect other workers or records already applied
 * - An export failure is fatal and propagates to the caller
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionCoordinator {

    private final CsvTransactionReader reader;
    private final TransactionProcessor processor;
    private final IngestionSettings settings;
    private final LedgerMetrics metrics;

    /**
     * Ingests every source into a fresh ledger, then writes the account snapshot.
     *
     * @param sources input file paths
     * @param writer serializer for the final accounts
     * @param out destination of the snapshot, left open
     * @return per-stream results
     * @throws UncheckedIOException if the snapshot cannot be written
     */
    public IngestionReport run(List<String> sources, AccountWriter writer, OutputStream out) {
        Ledger ledger = new Ledger();
        IngestionReport report = ingest(sources, ledger);

        List<AccountSnapshot> accounts = ledger.snapshotAccounts();
        try {
            writer.write(accounts, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export " + accounts.size() + " accounts", e);
        }
        log.info("Exported {} accounts from {} stored transactions", accounts.size(), ledger.transactionCount());
        return report;
    }

    /**
     * Ingests every source into {@code ledger} and waits for all workers to finish.
     */
    public IngestionReport ingest(List<String> sources, Ledger ledger) {
        if (sources.isEmpty()) {
            log.info("No input streams given");
            return new IngestionReport(List.of());
        }

        String runId = IngestionContext.generateRunId();
        int workers = settings.workerCount(sources.size());
        log.info("Run {}: ingesting {} streams with {} workers", runId, sources.size(), workers);

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory(runId));
        try {
            IngestionReport report = metrics.timeIngestion(() -> {
                List<CompletableFuture<StreamResult>> futures = sources.stream()
                        .map(source -> CompletableFuture.supplyAsync(() -> consume(runId, source, ledger), executor))
                        .collect(Collectors.toList());
                return new IngestionReport(futures.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
            });

            log.info("Run {}: {} records applied across {} accounts, {} of {} streams failed",
                    runId, report.totalRecordsApplied(), ledger.accountCount(),
                    report.failedStreamCount(), sources.size());
            return report;
        } finally {
            executor.shutdown();
        }
    }

    private StreamResult consume(String runId, String source, Ledger ledger) {
        IngestionContext.enter(runId, source);
        try {
            StreamResult result = consumeSource(source, ledger);
            metrics.recordStreamFinished(result.getStatus().name());
            return result;
        } finally {
            IngestionContext.clear();
        }
    }

    private StreamResult consumeSource(String source, Ledger ledger) {
        TransactionSource records;
        try {
            records = reader.open(source);
        } catch (IOException e) {
            log.error("Cannot open {}: {}", source, e.getMessage());
            return StreamResult.unreadable(source, e.getMessage());
        }

        StreamProgress progress = new StreamProgress();
        try (records) {
            return drain(records, ledger, progress);
        } catch (JsonProcessingException e) {
            log.error("Malformed CSV in {} after {} records: {}", source, progress.applied, e.getOriginalMessage());
            return StreamResult.malformed(source, progress.applied, progress.skipped, e.getOriginalMessage());
        } catch (IOException e) {
            log.error("Read of {} failed after {} records: {}", source, progress.applied, e.getMessage());
            return StreamResult.failed(source, progress.applied, progress.skipped, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while ingesting {} after {} records", source, progress.applied, e);
            return StreamResult.failed(source, progress.applied, progress.skipped, e.getMessage());
        }
    }

    private StreamResult drain(TransactionSource records, Ledger ledger, StreamProgress progress) throws IOException {
        String source = records.getName();
        while (true) {
            Optional<TransactionRecord> next;
            try {
                next = records.next();
            } catch (MalformedRecordException e) {
                if (settings.getMalformedRowPolicy() == MalformedRowPolicy.ABORT) {
                    log.error("Abandoning {} after {} records: {}", source, progress.applied, e.getMessage());
                    return StreamResult.malformed(source, progress.applied, progress.skipped, e.getMessage());
                }
                log.warn("Skipping row: {}", e.getMessage());
                metrics.recordRowSkipped();
                progress.skipped++;
                continue;
            }

            if (next.isEmpty()) {
                log.info("Finished {}: {} records applied, {} rows skipped", source, progress.applied, progress.skipped);
                return StreamResult.completed(source, progress.applied, progress.skipped);
            }
            processor.process(next.get(), ledger);
            progress.applied++;
        }
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ingest-" + runId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class StreamProgress {
        private long applied;
        private long skipped;
    }
}
