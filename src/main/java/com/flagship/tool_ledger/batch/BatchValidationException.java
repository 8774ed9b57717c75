package com.flagship.tool_ledger.batch;

import lombok.Getter;

@Getter
public class BatchValidationException extends RuntimeException {

    private final ScanRejection reason;
    private final String uniqueId;

    public BatchValidationException(ScanRejection reason, String uniqueId, String message) {
        super(message);
        this.reason = reason;
        this.uniqueId = uniqueId;
    }
}
