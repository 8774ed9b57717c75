package com.flagship.tool_ledger.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.tool_ledger.custody.ErrorCategory;
import com.flagship.tool_ledger.custody.ErrorKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Result of one item of a submitted batch.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ItemOutcome {
    String itemId;
    String uniqueId;
    boolean success;
    String entryId;
    Instant committedAt;
    /** Null on success, and for failures outside the custody error taxonomy. */
    ErrorKind errorKind;
    ErrorCategory errorCategory;
    String message;
}
