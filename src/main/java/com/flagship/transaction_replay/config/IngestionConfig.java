package com.flagship.transaction_replay.config;

import com.flagship.transaction_replay.ingestion.IngestionSettings;
import com.flagship.transaction_replay.ingestion.MalformedRowPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ingestion configuration.
 *
 * Properties:
 * - ledger.ingestion.max-workers: cap on concurrent stream workers (0 = one per stream)
 * - ledger.ingestion.malformed-row-policy: ABORT or SKIP
 * - ledger.ingestion.strict-amounts: reject rows whose amount is not a number
 */
@Configuration
public class IngestionConfig {

    @Value("${ledger.ingestion.max-workers:0}")
    private int maxWorkers;

    @Value("${ledger.ingestion.malformed-row-policy:ABORT}")
    private MalformedRowPolicy malformedRowPolicy;

    @Value("${ledger.ingestion.strict-amounts:false}")
    private boolean strictAmounts;

    @Bean
    public IngestionSettings ingestionSettings() {
        return IngestionSettings.builder()
                .maxWorkers(maxWorkers)
                .malformedRowPolicy(malformedRowPolicy)
                .strictAmounts(strictAmounts)
                .build();
    }
}
