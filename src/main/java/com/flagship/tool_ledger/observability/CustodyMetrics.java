package com.flagship.tool_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for custody operations, ledger writes and batch submissions.
 *
 * Metrics exposed:
 * - custody.operations{action,result}: completed checkout/checkin/usage/restock calls
 * - custody.latency{action}: wall time of the atomic phase plus ledger writes
 * - ledger.writes{ledger,result}: best-effort appends to the item and global ledgers
 * - batch.submissions{type,result}: submitted batches by outcome
 * - idempotency.cache{result}: replayed vs. new keyed requests
 */
@Component
public class CustodyMetrics {

    private final MeterRegistry registry;

    public CustodyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String action, String result) {
        registry.counter("custody.operations",
                "action", sanitizeTag(action),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordLatency(String action, long durationMs) {
        registry.timer("custody.latency",
                "action", sanitizeTag(action)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordLedgerWrite(String ledger, boolean success) {
        registry.counter("ledger.writes",
                "ledger", sanitizeTag(ledger),
                "result", success ? "success" : "failure"
        ).increment();
    }

    public void recordBatchSubmitted(String type, String result) {
        registry.counter("batch.submissions",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values to a small known alphabet to avoid cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
