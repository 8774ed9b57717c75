package com.flagship.tool_ledger.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PostgreSQL document store:
 * - Transactions commit atomically and resolve server timestamps to the commit time
 * - Concurrent read-modify-write transactions serialize on row locks
 * - Array appends from many writers all land
 * - Creating an absent document never overwrites a concurrent creator
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcDocumentStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("tool_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("store.type", () -> "jdbc");
    }

    @Autowired
    private DocumentStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private static void awaitBarrier(CyclicBarrier barrier) {
        try {
            barrier.await(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException("Barrier not reached", e);
        }
    }

    @Test
    @DisplayName("The JDBC store is the active implementation")
    void jdbcStoreIsActive() {
        assertInstanceOf(JdbcDocumentStore.class, store);
        assertTrue(store.ping());
    }

    @Test
    @DisplayName("A committed transaction writes every document with the commit time")
    void transactionCommits() {
        DocumentRef a = DocumentRef.of("widgets", unique("a"));
        DocumentRef b = DocumentRef.of("widgets", unique("b"));

        TransactionResult<String> result = store.runTransaction(txn -> {
            assertFalse(txn.get(a).exists());
            txn.set(a, Map.of("name", "first", "updatedAt", FieldValue.serverTimestamp()), false);
            txn.set(b, Map.of("name", "second"), false);
            return "done";
        });

        assertEquals("done", result.getValue());
        assertEquals(1, result.getAttempts());
        DocumentSnapshot first = store.get(a);
        assertEquals("first", first.get("name"));
        assertEquals(result.getCommitTime(), Instant.parse((String) first.get("updatedAt")));
        assertEquals(1L, first.getVersion());
        assertTrue(store.get(b).exists());
        assertEquals("widgets", jdbcTemplate.queryForObject(
            "SELECT parent_path FROM documents WHERE path = ?", String.class, a.getPath()));
    }

    @Test
    @DisplayName("A failing transaction function writes nothing")
    void failedTransactionWritesNothing() {
        DocumentRef ref = DocumentRef.of("widgets", unique("failed"));

        assertThrows(IllegalStateException.class, () -> store.runTransaction(txn -> {
            txn.set(ref, Map.of("name", "never"), false);
            throw new IllegalStateException("precondition failed");
        }));

        assertFalse(store.get(ref).exists());
    }

    @Test
    @DisplayName("Updating a missing document fails the transaction")
    void updateRequiresDocument() {
        DocumentRef ref = DocumentRef.of("widgets", unique("missing"));

        assertThrows(DocumentWriteException.class, () -> store.runTransaction(txn -> {
            txn.get(ref);
            txn.update(ref, Map.of("name", "x"));
            return null;
        }));
    }

    @Test
    @DisplayName("Merge keeps untouched fields; replace drops them")
    void mergeAndReplace() {
        DocumentRef ref = DocumentRef.of("widgets", unique("merge"));
        store.set(ref, Map.of("a", 1, "b", 2), false);

        store.set(ref, Map.of("b", 3), true);
        assertEquals(1, ((Number) store.get(ref).get("a")).intValue());
        assertEquals(3, ((Number) store.get(ref).get("b")).intValue());

        store.set(ref, Map.of("c", 4), false);
        assertNull(store.get(ref).get("a"));
        assertEquals(3L, store.get(ref).getVersion());
    }

    @Test
    @DisplayName("Concurrent increments of one counter are never lost")
    void concurrentIncrements() throws Exception {
        DocumentRef ref = DocumentRef.of("counters", unique("c"));
        store.set(ref, Map.of("count", 0), false);
        int threads = 6;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.runTransaction(txn -> {
                        int count = ((Number) txn.get(ref).get("count")).intValue();
                        txn.update(ref, Map.of("count", count + 1));
                        return null;
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(threads * perThread, ((Number) store.get(ref).get("count")).intValue());
    }

    @Test
    @DisplayName("Concurrent array appends to a new bucket all land")
    void concurrentAppends() throws Exception {
        assertTrue(store.supportsAtomicArrayAppend());
        DocumentRef bucket = DocumentRef.parse("tools/" + unique("t") + "/history/03-2024");
        int writers = 20;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            int n = i;
            futures.add(executor.submit(() -> {
                start.await();
                Map<String, Object> element = new HashMap<>();
                element.put("id", "entry-" + n);
                store.appendToArray(bucket, "transactions", element, Map.of("monthKey", "03-2024"));
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        DocumentSnapshot snapshot = store.get(bucket);
        assertEquals(writers, snapshot.getMapList("transactions").size());
        assertEquals("03-2024", snapshot.get("monthKey"));
    }

    @Test
    @DisplayName("Two transactions creating the same absent document: one wins, the other sees it on retry")
    void concurrentCreateIfAbsent() throws Exception {
        DocumentRef code = DocumentRef.of("item_codes", unique("T1234"));
        CyclicBarrier bothRead = new CyclicBarrier(2);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<Boolean>> futures = new ArrayList<>();

        for (String owner : List.of("tool-a", "tool-b")) {
            futures.add(executor.submit(() -> {
                boolean[] firstAttempt = {true};
                return store.runTransaction(txn -> {
                    boolean exists = txn.get(code).exists();
                    if (firstAttempt[0]) {
                        firstAttempt[0] = false;
                        // Both attempts observe the document as missing before either writes
                        awaitBarrier(bothRead);
                    }
                    if (exists) {
                        return false;
                    }
                    txn.set(code, Map.of("itemId", owner), false);
                    return true;
                }).getValue();
            }));
        }

        int created = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(30, TimeUnit.SECONDS)) {
                created++;
            }
        }
        executor.shutdown();

        assertEquals(1, created);
        DocumentSnapshot stored = store.get(code);
        assertEquals(1L, stored.getVersion());
        assertTrue(List.of("tool-a", "tool-b").contains(stored.get("itemId")));
    }

    @Test
    @DisplayName("Listing returns the direct children of a collection only")
    void listsDirectChildren() {
        String toolId = unique("t");
        String collection = "gadgets-" + UUID.randomUUID();
        store.set(DocumentRef.of(collection, toolId), Map.of("name", "drill"), false);
        store.set(DocumentRef.parse(collection + "/" + toolId + "/history/03-2024"), Map.of("transactions", List.of()), false);

        List<DocumentSnapshot> children = store.list(collection);

        assertEquals(1, children.size());
        assertEquals(toolId, children.get(0).getRef().getId());
    }

    @Test
    @DisplayName("Committed writes are published to subscribers of the collection")
    void publishesChanges() {
        String collection = "gadgets-" + UUID.randomUUID();
        List<DocumentSnapshot> received = new ArrayList<>();
        Subscription subscription = store.subscribe(collection, received::add);
        try {
            store.runTransaction(txn -> {
                txn.set(DocumentRef.of(collection, "g1"), Map.of("name", "saw"), false);
                return null;
            });
        } finally {
            subscription.cancel();
        }

        assertEquals(1, received.size());
        assertEquals("saw", received.get(0).get("name"));
    }
}
