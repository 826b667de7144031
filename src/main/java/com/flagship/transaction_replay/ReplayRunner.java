package com.flagship.transaction_replay;

import com.flagship.transaction_replay.export.AccountWriter;
import com.flagship.transaction_replay.ingestion.IngestionCoordinator;
import com.flagship.transaction_replay.ingestion.IngestionReport;
import com.flagship.transaction_replay.ingestion.StreamResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command-line entry point.
 *
 * Every non-option argument is an input CSV path. Options such as
 * {@code --ledger.ingestion.max-workers=4} are left to Spring's property binding.
 * The account snapshot goes to standard output; logs go to standard error.
 *
 * Failed input streams are reported in the log only. A failed export escapes
 * as an exception, which makes the process exit non-zero.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ledger.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ReplayRunner implements ApplicationRunner {

    private final IngestionCoordinator coordinator;
    private final AccountWriter accountWriter;

    @Override
    public void run(ApplicationArguments args) {
        List<String> sources = args.getNonOptionArgs();

        IngestionReport report = coordinator.run(sources, accountWriter, System.out);
        if (report.allSuccessful()) {
            log.info("Replayed {} records from {} streams", report.totalRecordsApplied(), sources.size());
            return;
        }

        for (StreamResult result : report.getStreams()) {
            if (!result.isSuccessful()) {
                log.warn("Stream {} ended {} after {} records: {}",
                        result.getSource(), result.getStatus(), result.getRecordsApplied(), result.getFailureReason());
            }
        }
    }
}
