package com.flagship.tool_ledger.custody.exception;

import com.flagship.tool_ledger.custody.CustodyException;
import com.flagship.tool_ledger.custody.ErrorKind;
import com.flagship.tool_ledger.custody.IdempotencyKeyInProgressException;
import com.flagship.tool_ledger.store.TransactionConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP mapping of custody failures by category.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Contention is reported as retryable 503")
    void transactionConflictIsServiceUnavailable() {
        CustodyException conflict = new CustodyException(ErrorKind.TRANSACTION_CONFLICT, "t1",
            "Too much contention on item t1, please retry", new TransactionConflictException(5, null));

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleCustodyException(conflict);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("TRANSACTION_CONFLICT", response.getBody().getError());
        assertEquals("TRANSACTION_CONFLICT", response.getBody().getDetails().get("kind"));
        assertEquals("t1", response.getBody().getDetails().get("itemId"));
    }

    @Test
    @DisplayName("Not found and precondition failures are 404 and 409")
    void otherCategories() {
        assertEquals(HttpStatus.NOT_FOUND, handler.handleCustodyException(
            new CustodyException(ErrorKind.ITEM_NOT_FOUND, "t1", "missing")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT, handler.handleCustodyException(
            new CustodyException(ErrorKind.ALREADY_CHECKED_OUT, "t1", "already out")).getStatusCode());
    }

    @Test
    @DisplayName("A duplicate of an in-flight keyed request is 409 with the key")
    void keyInProgressIsConflict() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
            handler.handleKeyInProgress(new IdempotencyKeyInProgressException("key-9"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("Request In Progress", response.getBody().getError());
        assertEquals("key-9", response.getBody().getDetails().get("idempotencyKey"));
    }
}
