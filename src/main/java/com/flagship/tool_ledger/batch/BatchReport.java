package com.flagship.tool_ledger.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Per-item results of a batch submission. A batch is not atomic, so any mix of
 * successes and failures is possible.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchReport {
    String batchId;
    BatchType type;
    List<ItemOutcome> outcomes;
    int successCount;
    int failureCount;

    public static BatchReport of(String batchId, BatchType type, List<ItemOutcome> outcomes) {
        int successes = (int) outcomes.stream().filter(ItemOutcome::isSuccess).count();
        return new BatchReport(batchId, type, List.copyOf(outcomes), successes, outcomes.size() - successes);
    }

    @JsonIgnore
    public boolean isFullySuccessful() {
        return failureCount == 0;
    }

    @JsonIgnore
    public boolean isPartialFailure() {
        return failureCount > 0 && successCount > 0;
    }
}
