package com.flagship.tool_ledger.custody;

import com.flagship.tool_ledger.inventory.Staff;
import com.flagship.tool_ledger.inventory.Tool;
import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Idempotent request handling:
 * - A repeated key replays the first outcome without running the action again
 * - The document store is the source of truth when Redis is missing or failing
 * - Rejections are not recorded
 * - A key cannot be reused for another operation
 * - A retry sent while the first request is in flight waits for its outcome
 */
class IdempotencyServiceTest {

    private LedgerFixture fixture;
    private IdempotencyService service;
    private AtomicInteger executions;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        service = withRedis(Optional.empty());
        executions = new AtomicInteger();
    }

    private IdempotencyService withRedis(Optional<StringRedisTemplate> redis) {
        return withRedis(redis, Duration.ofSeconds(5));
    }

    private IdempotencyService withRedis(Optional<StringRedisTemplate> redis, Duration pendingWait) {
        return new IdempotencyService(fixture.getStore(), fixture.getObjectMapper(), redis,
            Duration.ofDays(7), pendingWait, Duration.ofMinutes(2), fixture.getServerClock(), fixture.getMetrics());
    }

    private CustodyReceipt receipt(String entryId) {
        executions.incrementAndGet();
        return CustodyReceipt.builder()
            .entryId(entryId)
            .itemId("t1")
            .itemUniqueId("T1234")
            .committedAt(LedgerFixture.START)
            .build();
    }

    @Test
    @DisplayName("Same key twice: the action runs once and the first outcome is replayed")
    void replaysRecordedOutcome() {
        CustodyReceipt first = service.execute("key-1", "checkout:t1", CustodyReceipt.class, () -> receipt("e1"));
        CustodyReceipt second = service.execute("key-1", "checkout:t1", CustodyReceipt.class, () -> receipt("e2"));

        assertEquals(1, executions.get());
        assertEquals(first, second);
        assertEquals("e1", second.getEntryId());
        assertTrue(fixture.getStore().get(DocumentRef.of(IdempotencyService.COLLECTION, "key-1")).exists());
        assertEquals(1.0, fixture.counter("idempotency.cache", "result", "hit"));
        assertEquals(1.0, fixture.counter("idempotency.cache", "result", "miss"));
    }

    @Test
    @DisplayName("Without a key every call runs")
    void blankKeyDisablesCheck() {
        service.execute(null, "checkout:t1", CustodyReceipt.class, () -> receipt("e1"));
        service.execute(" ", "checkout:t1", CustodyReceipt.class, () -> receipt("e2"));

        assertEquals(2, executions.get());
        assertEquals(0, fixture.getStore().size());
    }

    @Test
    @DisplayName("A rejected operation is not recorded and can be retried with the same key")
    void rejectionsAreNotRecorded() {
        assertThrows(CustodyException.class, () -> service.execute("key-2", "checkout:t1", CustodyReceipt.class,
            () -> {
                throw new CustodyException(ErrorKind.ALREADY_CHECKED_OUT, "t1", "already out");
            }));

        CustodyReceipt retried = service.execute("key-2", "checkout:t1", CustodyReceipt.class, () -> receipt("e3"));

        assertEquals("e3", retried.getEntryId());
        assertEquals(1, executions.get());
        assertEquals(IdempotencyService.STATE_COMPLETED,
            fixture.getStore().get(DocumentRef.of(IdempotencyService.COLLECTION, "key-2")).get("state"));
    }

    @Test
    @DisplayName("Reusing a key for a different operation is refused")
    void keyBoundToOperation() {
        service.execute("key-3", "checkout:t1", CustodyReceipt.class, () -> receipt("e1"));

        assertThrows(IllegalStateException.class,
            () -> service.execute("key-3", "checkin:t1", CustodyReceipt.class, () -> receipt("e2")));
        assertEquals(1, executions.get());
    }

    @Test
    @DisplayName("Keys with path separators are rejected")
    void invalidKey() {
        assertThrows(IllegalArgumentException.class,
            () -> service.execute("a/b", "checkout:t1", CustodyReceipt.class, () -> receipt("e1")));
        assertEquals(0, executions.get());
    }

    @Test
    @DisplayName("A Redis outage falls back to the document store")
    @SuppressWarnings("unchecked")
    void redisOutageFallsBackToStore() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        when(values.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        IdempotencyService degraded = withRedis(Optional.of(redis));

        degraded.execute("key-4", "checkout:t1", CustodyReceipt.class, () -> receipt("e1"));
        CustodyReceipt replayed = degraded.execute("key-4", "checkout:t1", CustodyReceipt.class, () -> receipt("e2"));

        assertEquals("e1", replayed.getEntryId());
        assertEquals(1, executions.get());
    }

    @Test
    @DisplayName("A Redis hit is served without touching the action")
    @SuppressWarnings("unchecked")
    void redisHitIsServed() throws Exception {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        String cached = "{\"operation\":\"checkout:t1\",\"response\":{\"entryId\":\"cached\",\"itemId\":\"t1\"}}";
        when(values.get("tool-ledger:idempotency:key-5")).thenReturn(cached);
        IdempotencyService cachedService = withRedis(Optional.of(redis));

        CustodyReceipt replayed = cachedService.execute("key-5", "checkout:t1", CustodyReceipt.class,
            () -> receipt("e1"));

        assertEquals("cached", replayed.getEntryId());
        assertEquals(0, executions.get());
        verify(values, never()).set(eq("tool-ledger:idempotency:key-5"), anyString(), eq(Duration.ofDays(7)));
    }

    @Test
    @DisplayName("A retry sent while the first checkout is in flight replays its outcome")
    void concurrentDuplicateWaitsForOriginal() throws Exception {
        Staff admin = fixture.admin("Ada Admin");
        Staff worker = fixture.staff("Wes Worker", "W-1");
        Tool tool = fixture.tool("T1234");
        String operation = "checkout:" + tool.getId();
        CountDownLatch committed = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<CustodyReceipt> first = executor.submit(() -> service.execute("k1", operation,
                CustodyReceipt.class, () -> {
                    CustodyReceipt receipt = fixture.getCustody().checkout(tool.getId(), worker.getUid(), admin.getUid());
                    committed.countDown();
                    awaitQuietly(proceed);
                    return receipt;
                }));
            assertTrue(committed.await(5, TimeUnit.SECONDS));

            Future<Object> retry = executor.submit(() -> {
                try {
                    return service.execute("k1", operation, CustodyReceipt.class,
                        () -> fixture.getCustody().checkout(tool.getId(), worker.getUid(), admin.getUid()));
                } catch (RuntimeException e) {
                    return e;
                }
            });
            Thread.sleep(100);
            assertFalse(retry.isDone(), "retry should wait for the in-flight original");
            proceed.countDown();

            CustodyReceipt original = first.get(5, TimeUnit.SECONDS);
            Object replayed = retry.get(5, TimeUnit.SECONDS);
            assertFalse(replayed instanceof CustodyException, "retry must not run the checkout again: " + replayed);
            assertEquals(original, replayed);
            assertEquals(1.0, fixture.counter("idempotency.cache", "result", "hit"));
            assertEquals(1.0, fixture.counter("custody.operations", "action", "checkout", "result", "success"));
        } finally {
            proceed.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A duplicate gives up with a conflict when the original outlasts the wait")
    void duplicateGivesUpAfterWait() throws Exception {
        IdempotencyService impatient = withRedis(Optional.empty(), Duration.ofMillis(50));
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<CustodyReceipt> first = executor.submit(() -> impatient.execute("k2", "checkout:t1",
                CustodyReceipt.class, () -> {
                    running.countDown();
                    awaitQuietly(proceed);
                    return receipt("e1");
                }));
            assertTrue(running.await(5, TimeUnit.SECONDS));

            IdempotencyKeyInProgressException e = assertThrows(IdempotencyKeyInProgressException.class,
                () -> impatient.execute("k2", "checkout:t1", CustodyReceipt.class, () -> receipt("e2")));
            assertEquals("k2", e.getKey());

            proceed.countDown();
            assertEquals("e1", first.get(5, TimeUnit.SECONDS).getEntryId());
            assertEquals(1, executions.get());
        } finally {
            proceed.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A reservation abandoned past its lease is taken over")
    void abandonedReservationIsTakenOver() {
        DocumentRef ref = DocumentRef.of(IdempotencyService.COLLECTION, "k3");
        Map<String, Object> pending = new LinkedHashMap<>();
        pending.put("operation", "checkout:t1");
        pending.put("state", IdempotencyService.STATE_PENDING);
        pending.put("owner", "crashed-node");
        pending.put("reservedAtMillis", LedgerFixture.START.toEpochMilli());
        fixture.getStore().set(ref, pending, false);

        IdempotencyService noWait = withRedis(Optional.empty(), Duration.ZERO);
        assertThrows(IdempotencyKeyInProgressException.class,
            () -> noWait.execute("k3", "checkout:t1", CustodyReceipt.class, () -> receipt("e1")));
        assertEquals(0, executions.get());

        fixture.getClock().advance(Duration.ofMinutes(3));
        CustodyReceipt result = noWait.execute("k3", "checkout:t1", CustodyReceipt.class, () -> receipt("e2"));

        assertEquals("e2", result.getEntryId());
        assertEquals(IdempotencyService.STATE_COMPLETED, fixture.getStore().get(ref).get("state"));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Timed out waiting for test latch");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
