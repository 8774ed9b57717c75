package com.flagship.tool_ledger.batch;

import com.flagship.tool_ledger.batch.dto.BatchSessionResponse;
import com.flagship.tool_ledger.batch.dto.OpenBatchRequest;
import com.flagship.tool_ledger.batch.dto.ScanRequest;
import com.flagship.tool_ledger.batch.dto.SubmitBatchRequest;
import com.flagship.tool_ledger.custody.IdempotencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for batch sessions: open, scan, remove, submit, discard.
 *
 * Sessions live in memory on this instance; clients should stick to one node.
 */
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
@Slf4j
public class BatchController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final BatchSessionRegistry sessions;
    private final BatchCoordinator coordinator;
    private final IdempotencyService idempotencyService;

    @PostMapping
    public ResponseEntity<BatchSessionResponse> open(@Valid @RequestBody OpenBatchRequest request) {
        BatchSession session = sessions.open(request.getActingStaffUid());
        if (request.getType() != null) {
            session.selectType(request.getType());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchSessionResponse.from(session));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BatchSessionResponse> get(@PathVariable("id") String sessionId) {
        return ResponseEntity.ok(BatchSessionResponse.from(sessions.get(sessionId)));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<BatchSessionResponse> scan(@PathVariable("id") String sessionId,
                                                     @Valid @RequestBody ScanRequest request) {
        BatchSession session = sessions.get(sessionId);
        coordinator.scanIntoBatch(session, request.getCode(), request.getQuantity());
        return ResponseEntity.ok(BatchSessionResponse.from(session));
    }

    @DeleteMapping("/{id}/items/{itemId}")
    public ResponseEntity<BatchSessionResponse> remove(@PathVariable("id") String sessionId,
                                                       @PathVariable("itemId") String itemId) {
        BatchSession session = sessions.get(sessionId);
        if (!session.remove(itemId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(BatchSessionResponse.from(session));
    }

    /**
     * Submits the batch. The report lists every item; a partial failure is still 200 and
     * the failed items remain in the session.
     */
    @PostMapping("/{id}/submit")
    public ResponseEntity<BatchReport> submit(
            @PathVariable("id") String sessionId,
            @Valid @RequestBody SubmitBatchRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        BatchSession session = sessions.get(sessionId);
        log.info("Received batch submit: session={}, type={}, items={}",
                sessionId, session.getType(), session.getItems().size());

        BatchReport report = idempotencyService.execute(idempotencyKey, "batch-submit:" + sessionId,
            BatchReport.class,
            () -> coordinator.submitBatch(session, request.getTargetStaffUid(), request.getNotes()));
        return ResponseEntity.ok(report);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> discard(@PathVariable("id") String sessionId) {
        BatchSession session = sessions.get(sessionId);
        coordinator.clearBatch(session);
        sessions.close(sessionId);
        return ResponseEntity.noContent().build();
    }
}
