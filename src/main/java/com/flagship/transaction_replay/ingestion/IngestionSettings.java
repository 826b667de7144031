package com.flagship.transaction_replay.ingestion;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for an ingestion run.
 *
 * Built from {@code ledger.ingestion.*} properties by
 * {@link com.flagship.transaction_replay.config.IngestionConfig}.
 */
@Value
@Builder
public class IngestionSettings {

    /**
     * Upper bound on concurrent workers. Zero or less means one worker per stream.
     */
    @Builder.Default
    int maxWorkers = 0;

    @Builder.Default
    MalformedRowPolicy malformedRowPolicy = MalformedRowPolicy.ABORT;

    /**
     * When set, a non-numeric amount makes the row malformed instead of reading as zero.
     */
    @Builder.Default
    boolean strictAmounts = false;

    public static IngestionSettings defaults() {
        return IngestionSettings.builder().build();
    }

    public int workerCount(int streams) {
        return maxWorkers > 0 ? Math.min(maxWorkers, streams) : streams;
    }
}
