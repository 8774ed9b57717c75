package com.flagship.tool_ledger.history;

import com.flagship.tool_ledger.store.DocumentRef;
import com.flagship.tool_ledger.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GlobalHistoryLedgerTest {

    @Test
    @DisplayName("Entries land in the day bucket of their timestamp")
    void appendsToDayBucket() {
        LedgerFixture fixture = new LedgerFixture();
        GlobalHistoryLedger ledger = fixture.getGlobalLedger();

        ledger.append(LedgerTestEntries.checkout("t1", "s1", Instant.parse("2024-03-15T23:59:59Z")));
        ledger.append(LedgerTestEntries.checkout("t2", "s1", Instant.parse("2024-03-16T00:00:01Z")));

        var day = fixture.getStore().get(DocumentRef.parse("global_history/2024/03/15"));
        assertEquals(1, day.getMapList(BucketWriter.TRANSACTIONS).size());
        assertEquals("2024/03/15", day.get("dateKey"));
        assertEquals(1, fixture.getStore().get(DocumentRef.parse("global_history/2024/03/16"))
            .getMapList(BucketWriter.TRANSACTIONS).size());
    }

    @Test
    @DisplayName("Filters match on item, staff (actor or assignee), action and batch")
    void filters() {
        LedgerFixture fixture = new LedgerFixture();
        GlobalHistoryLedger ledger = fixture.getGlobalLedger();
        Instant base = Instant.parse("2024-03-15T08:00:00Z");
        ledger.append(LedgerTestEntries.checkout("t1", "s1", base));
        ledger.append(LedgerTestEntries.checkin("t1", "s1", base.plusSeconds(60)));
        ledger.append(LedgerTestEntries.checkout("t2", "s2", base.plusSeconds(120)));
        ledger.append(LedgerTestEntries.checkout("t3", "s2", base.plusSeconds(180)).toBuilder().batchId("BATCH_1").build());

        Instant start = base.minusSeconds(3600);
        Instant end = base.plusSeconds(3600);
        assertEquals(2, ledger.query(start, end, HistoryFilter.builder().itemId("t1").build(), 10).size());
        assertEquals(2, ledger.query(start, end, HistoryFilter.builder().staffUid("s2").build(), 10).size());
        assertEquals(4, ledger.query(start, end, HistoryFilter.builder().staffUid("admin").build(), 10).size());
        assertEquals(1, ledger.query(start, end, HistoryFilter.builder().action(HistoryAction.CHECKIN).build(), 10).size());
        assertEquals("t3", ledger.findBatch("BATCH_1", start, end).get(0).getItemId());
    }

    @Test
    @DisplayName("Without atomic append, concurrent writers to one bucket lose nothing")
    void readModifyWriteFallbackIsSerialized() throws Exception {
        LedgerFixture fixture = new LedgerFixture(false);
        GlobalHistoryLedger ledger = fixture.getGlobalLedger();
        Instant at = Instant.parse("2024-03-15T12:00:00Z");

        int threads = 8;
        int perThread = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    ledger.append(LedgerTestEntries.checkout("t" + thread + "-" + i, "s1", at.plusMillis(i)));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertFalse(fixture.getStore().supportsAtomicArrayAppend());
        assertEquals(threads * perThread, fixture.getStore().get(DocumentRef.parse("global_history/2024/03/15"))
            .getMapList(BucketWriter.TRANSACTIONS).size());
    }
}
