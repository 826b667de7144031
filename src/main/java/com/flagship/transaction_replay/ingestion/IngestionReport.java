package com.flagship.transaction_replay.ingestion;

import lombok.Value;

import java.util.List;

/**
 * Per-stream results of an ingestion run, in the order the sources were given.
 */
@Value
public class IngestionReport {
    List<StreamResult> streams;

    public IngestionReport(List<StreamResult> streams) {
        this.streams = List.copyOf(streams);
    }

    public long totalRecordsApplied() {
        return streams.stream().mapToLong(StreamResult::getRecordsApplied).sum();
    }

    public long failedStreamCount() {
        return streams.stream().filter(result -> !result.isSuccessful()).count();
    }

    public boolean allSuccessful() {
        return failedStreamCount() == 0;
    }
}
