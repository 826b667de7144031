package com.flagship.transaction_replay.observability;

import com.flagship.transaction_replay.transaction.ApplyOutcome;
import com.flagship.transaction_replay.transaction.TransactionType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for replay runs.
 *
 * Metrics exposed:
 * - ledger.records: records applied, tagged with type and outcome
 * - ledger.streams: finished input streams, tagged with status
 * - ledger.rows.skipped: malformed rows skipped under the SKIP policy
 * - ledger.ingestion.duration: wall time of a whole ingestion
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer ingestionTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.ingestionTimer = Timer.builder("ledger.ingestion.duration")
                .description("Time taken to ingest all input streams")
                .register(registry);
    }

    public void recordApplied(TransactionType type, ApplyOutcome outcome) {
        registry.counter("ledger.records",
                "type", type.getCode(),
                "outcome", outcome.name().toLowerCase()
        ).increment();
    }

    public void recordStreamFinished(String status) {
        registry.counter("ledger.streams", "status", status.toLowerCase()).increment();
    }

    public void recordRowSkipped() {
        registry.counter("ledger.rows.skipped").increment();
    }

    public <T> T timeIngestion(Supplier<T> operation) {
        return ingestionTimer.record(operation);
    }
}
