package com.flagship.tool_ledger.custody;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tool_ledger.observability.CustodyMetrics;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import com.flagship.tool_ledger.store.FieldValue;
import com.flagship.tool_ledger.store.ServerClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Supplier;

/**
 * Replays the recorded outcome of a keyed request instead of executing it again.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable). Redis only ever holds completed outcomes.
 * 2. Reserve the key in the document store at {@code idempotency_keys/{key}}, the source of truth.
 *    The reservation is a PENDING record created in a store transaction, so exactly one
 *    request per key runs the action.
 * 3. Complete the record with the outcome, then cache it in Redis.
 *
 * A duplicate that finds the key PENDING polls until the original completes and replays
 * its outcome, or answers {@link IdempotencyKeyInProgressException} after {@code pendingWait}.
 *
 * Only successful outcomes are recorded. A rejected custody operation changed nothing, so
 * its reservation is released and repeating it simply yields the same rejection.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String COLLECTION = "idempotency_keys";
    static final String STATE_PENDING = "PENDING";
    static final String STATE_COMPLETED = "COMPLETED";
    static final String STATE_RELEASED = "RELEASED";

    private static final String REDIS_KEY_PREFIX = "tool-ledger:idempotency:";
    private static final int MAX_KEY_LENGTH = 200;
    private static final long POLL_INTERVAL_MILLIS = 25;

    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration redisTtl;
    private final Duration pendingWait;
    private final Duration pendingLease;
    private final ServerClock serverClock;
    private final CustodyMetrics metrics;

    public IdempotencyService(DocumentStore store,
                              ObjectMapper objectMapper,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${idempotency.redis-ttl:7d}") Duration redisTtl,
                              @Value("${idempotency.pending-wait:5s}") Duration pendingWait,
                              @Value("${idempotency.pending-lease:2m}") Duration pendingLease,
                              ServerClock serverClock,
                              CustodyMetrics metrics) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.redisTemplate = redisTemplate;
        this.redisTtl = redisTtl;
        this.pendingWait = pendingWait;
        this.pendingLease = pendingLease;
        this.serverClock = serverClock;
        this.metrics = metrics;
    }

    /**
     * Runs {@code action} unless {@code key} already has a recorded outcome for the same
     * operation, in which case that outcome is returned. A null or blank key disables
     * the check.
     *
     * @throws IllegalStateException if the key was already used for a different operation
     * @throws IdempotencyKeyInProgressException if the first request with this key is still running
     */
    public <T> T execute(String key, String operation, Class<T> responseType, Supplier<T> action) {
        if (key == null || key.isBlank()) {
            return action.get();
        }
        validateKey(key);

        // Fast-path: a completed outcome cached in Redis
        Optional<T> cached = lookupRedis(key, operation, responseType);
        if (cached.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Replaying cached outcome for idempotency key {} ({})", key, operation);
            return cached.get();
        }

        String owner = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + pendingWait.toNanos();
        while (true) {
            DocumentSnapshot reservation = reserve(key, operation, owner);
            String state = (String) reservation.get("state");

            if (STATE_COMPLETED.equals(state)) {
                metrics.recordIdempotencyHit();
                log.info("Replaying recorded outcome for idempotency key {} ({})", key, operation);
                cacheInRedis(key, reservation.getData());
                return decode(reservation.getData(), key, operation, responseType);
            }
            if (owner.equals(reservation.get("owner"))) {
                metrics.recordIdempotencyMiss();
                return runReserved(key, operation, owner, action);
            }

            // Another request holds the key; wait for it to complete or release
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Idempotency key {} still in progress after {}", key, pendingWait);
                throw new IdempotencyKeyInProgressException(key);
            }
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(POLL_INTERVAL_MILLIS));
        }
    }

    private <T> T runReserved(String key, String operation, String owner, Supplier<T> action) {
        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            release(key, owner);
            throw e;
        }
        complete(key, operation, owner, result);
        return result;
    }

    /**
     * Creates a PENDING reservation owned by {@code owner} unless the key is completed or
     * held by a live reservation. Returns the record as it stands after the transaction.
     */
    private DocumentSnapshot reserve(String key, String operation, String owner) {
        DocumentRef ref = refFor(key);
        long now = serverClock.peek().toEpochMilli();
        return store.runTransaction(txn -> {
            DocumentSnapshot current = txn.get(ref);
            Object state = current.get("state");
            if (current.exists() && !STATE_RELEASED.equals(state)) {
                Object recordedOperation = current.get("operation");
                if (!operation.equals(recordedOperation)) {
                    throw new IllegalStateException(String.format(
                        "Idempotency key %s was already used for %s", key, recordedOperation));
                }
                // A record without state holds a completed outcome
                if (state == null || STATE_COMPLETED.equals(state)) {
                    return completedView(current);
                }
                if (STATE_PENDING.equals(state) && !leaseExpired(current, now)) {
                    return current;
                }
                if (STATE_PENDING.equals(state)) {
                    log.warn("Taking over abandoned reservation for idempotency key {}", key);
                }
            }
            Map<String, Object> pending = new LinkedHashMap<>();
            pending.put("operation", operation);
            pending.put("state", STATE_PENDING);
            pending.put("owner", owner);
            pending.put("reservedAtMillis", now);
            txn.set(ref, pending, false);
            return DocumentSnapshot.of(ref, pending, current.getVersion() + 1);
        }).getValue();
    }

    private void complete(String key, String operation, String owner, Object result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation);
        data.put("response", objectMapper.convertValue(result, Map.class));
        Map<String, Object> stored = new LinkedHashMap<>(data);
        stored.put("state", STATE_COMPLETED);
        stored.put("createdAt", FieldValue.serverTimestamp());

        DocumentRef ref = refFor(key);
        try {
            boolean written = store.runTransaction(txn -> {
                DocumentSnapshot current = txn.get(ref);
                if (current.exists() && !owner.equals(current.get("owner"))) {
                    return false;
                }
                txn.set(ref, stored, false);
                return true;
            }).getValue();
            if (!written) {
                log.warn("Reservation for idempotency key {} was taken over; outcome of {} not recorded", key, operation);
                return;
            }
        } catch (RuntimeException e) {
            // The operation itself committed; report its outcome even though replay will not be possible
            log.error("Failed to record idempotency key {} for {}: {}", key, operation, e.getMessage());
            return;
        }
        cacheInRedis(key, data);
    }

    private void release(String key, String owner) {
        DocumentRef ref = refFor(key);
        try {
            store.runTransaction(txn -> {
                DocumentSnapshot current = txn.get(ref);
                if (current.exists() && owner.equals(current.get("owner"))) {
                    txn.update(ref, Map.of("state", STATE_RELEASED));
                }
                return null;
            });
        } catch (RuntimeException e) {
            // The lease expiry frees the key eventually
            log.error("Failed to release idempotency key {}: {}", key, e.getMessage());
        }
    }

    private <T> Optional<T> lookupRedis(String key, String operation, Class<T> responseType) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        String cached;
        try {
            cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + key);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to document store. Error: {}",
                    key, e.getMessage());
            return Optional.empty();
        }
        if (cached == null) {
            return Optional.empty();
        }
        try {
            Map<String, Object> recorded = readRecord(cached);
            log.debug("Idempotency key found in Redis: {}", key);
            return Optional.of(decode(recorded, key, operation, responseType));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable Redis entry for idempotency key {}; using document store", key);
            return Optional.empty();
        }
    }

    private void cacheInRedis(String key, Map<String, Object> data) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            Map<String, Object> cached = new LinkedHashMap<>();
            cached.put("operation", data.get("operation"));
            cached.put("response", data.get("response"));
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + key, objectMapper.writeValueAsString(cached), redisTtl);
        } catch (Exception e) {
            // Non-critical, the document store is the source of truth
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private boolean leaseExpired(DocumentSnapshot pending, long nowMillis) {
        Object reservedAt = pending.get("reservedAtMillis");
        if (!(reservedAt instanceof Number)) {
            return true;
        }
        return nowMillis - ((Number) reservedAt).longValue() > pendingLease.toMillis();
    }

    private static DocumentSnapshot completedView(DocumentSnapshot record) {
        Map<String, Object> data = new LinkedHashMap<>(record.getData());
        data.put("state", STATE_COMPLETED);
        return DocumentSnapshot.of(record.getRef(), data, record.getVersion());
    }

    private <T> T decode(Map<String, Object> data, String key, String operation, Class<T> responseType) {
        Object recordedOperation = data.get("operation");
        if (!operation.equals(recordedOperation)) {
            throw new IllegalStateException(String.format(
                "Idempotency key %s was already used for %s", key, recordedOperation));
        }
        return objectMapper.convertValue(data.get("response"), responseType);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readRecord(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, Map.class);
    }

    private static DocumentRef refFor(String key) {
        return DocumentRef.of(COLLECTION, key);
    }

    private static void validateKey(String key) {
        if (key.length() > MAX_KEY_LENGTH || key.contains("/")) {
            throw new IllegalArgumentException("Idempotency key must be at most " + MAX_KEY_LENGTH
                + " characters and must not contain '/'");
        }
    }
}
