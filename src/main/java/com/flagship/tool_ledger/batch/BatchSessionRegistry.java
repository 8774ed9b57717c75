package com.flagship.tool_ledger.batch;

import com.flagship.tool_ledger.store.ServerClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Batch sessions of REST clients, keyed by session id. Sessions idle for longer than
 * {@code batch.session.ttl} are dropped; batches are never persisted.
 */
@Component
@Slf4j
public class BatchSessionRegistry {

    private final BatchCoordinator coordinator;
    private final ServerClock clock;
    private final Duration ttl;
    private final Map<String, BatchSession> sessions = new ConcurrentHashMap<>();

    public BatchSessionRegistry(BatchCoordinator coordinator,
                                ServerClock clock,
                                @Value("${batch.session.ttl:30m}") Duration ttl) {
        this.coordinator = coordinator;
        this.clock = clock;
        this.ttl = ttl;
    }

    public BatchSession open(String actingStaffUid) {
        BatchSession session = coordinator.startBatch(actingStaffUid);
        sessions.put(session.getSessionId(), session);
        log.info("Opened batch session {} for {}", session.getSessionId(), actingStaffUid);
        return session;
    }

    /**
     * @throws NoSuchElementException if the session does not exist or has expired
     */
    public BatchSession get(String sessionId) {
        BatchSession session = sessions.get(sessionId);
        if (session == null) {
            throw new NoSuchElementException("Batch session not found: " + sessionId);
        }
        return session;
    }

    public void close(String sessionId) {
        BatchSession session = sessions.remove(sessionId);
        if (session != null) {
            log.info("Closed batch session {}", sessionId);
        }
    }

    @Scheduled(fixedDelayString = "${batch.session.eviction-interval-ms:60000}")
    public void evictExpired() {
        Instant cutoff = clock.peek().minus(ttl);
        sessions.values().removeIf(session -> {
            boolean expired = session.getState() != BatchState.SUBMITTING && session.getLastTouched().isBefore(cutoff);
            if (expired) {
                log.info("Expired idle batch session {} ({} items)", session.getSessionId(), session.getItems().size());
            }
            return expired;
        });
    }

    public int size() {
        return sessions.size();
    }
}
