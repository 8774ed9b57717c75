package com.flagship.tool_ledger.store;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Shared behaviour of the store implementations:
 * 1. Bounded retry of transactions that lost a conflict
 * 2. Change notification for collection subscribers
 */
@Slf4j
public abstract class AbstractDocumentStore implements DocumentStore {

    private static final long BASE_BACKOFF_MILLIS = 5;

    protected final ServerClock serverClock;
    private final int maxAttempts;
    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();

    protected AbstractDocumentStore(ServerClock serverClock, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.serverClock = serverClock;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public <T> TransactionResult<T> runTransaction(TransactionFunction<T> function) {
        for (int attempt = 1; ; attempt++) {
            try {
                return attemptTransaction(function, attempt);
            } catch (ConflictDetectedException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Transaction gave up after {} attempts: {}", attempt, e.getMessage());
                    throw new TransactionConflictException(attempt, e);
                }
                log.debug("Transaction conflict on attempt {}: {}", attempt, e.getMessage());
                // Parking does not react to interrupts; a started commit sequence is never abandoned midway
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(BASE_BACKOFF_MILLIS * attempt));
            }
        }
    }

    /**
     * Runs one attempt. Implementations throw {@link ConflictDetectedException} when the
     * attempt must be retried; any other exception aborts the transaction immediately.
     */
    protected abstract <T> TransactionResult<T> attemptTransaction(TransactionFunction<T> function, int attempt);

    @Override
    public Subscription subscribe(String collectionPath, DocumentChangeListener listener) {
        Registration registration = new Registration(collectionPath, listener);
        listeners.computeIfAbsent(collectionPath, key -> new CopyOnWriteArrayList<>()).add(registration);
        return registration;
    }

    /**
     * Delivers committed snapshots to subscribers of their parent collection.
     */
    protected void publish(List<DocumentSnapshot> changed) {
        for (DocumentSnapshot snapshot : changed) {
            List<Registration> registrations = listeners.get(snapshot.getRef().getParentPath());
            if (registrations == null) {
                continue;
            }
            for (Registration registration : registrations) {
                try {
                    registration.listener.onChange(snapshot);
                } catch (RuntimeException e) {
                    log.warn("Change listener failed for {}: {}", snapshot.getRef(), e.getMessage(), e);
                }
            }
        }
    }

    /**
     * Signals a retryable conflict from inside an attempt.
     */
    protected static class ConflictDetectedException extends RuntimeException {

        public ConflictDetectedException(String message) {
            super(message);
        }

        public ConflictDetectedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final class Registration implements Subscription {
        private final String collectionPath;
        private final DocumentChangeListener listener;
        private volatile boolean active = true;

        private Registration(String collectionPath, DocumentChangeListener listener) {
            this.collectionPath = collectionPath;
            this.listener = listener;
        }

        @Override
        public void cancel() {
            active = false;
            List<Registration> registrations = listeners.get(collectionPath);
            if (registrations != null) {
                registrations.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
