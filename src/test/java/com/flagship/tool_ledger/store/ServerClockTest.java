package com.flagship.tool_ledger.store;

import com.flagship.tool_ledger.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ServerClockTest {

    @Test
    @DisplayName("Timestamps never repeat or go backwards")
    void monotonic() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        ServerClock serverClock = new ServerClock(clock);

        Instant first = serverClock.now();
        Instant second = serverClock.now();
        clock.advance(Duration.ofSeconds(-30));
        Instant third = serverClock.now();

        assertTrue(second.isAfter(first));
        assertTrue(third.isAfter(second));
        assertEquals(clock.instant(), serverClock.peek());
    }

    @Test
    @DisplayName("A moving clock is passed through unchanged")
    void followsWallClock() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        ServerClock serverClock = new ServerClock(clock);
        serverClock.now();

        clock.advance(Duration.ofMinutes(5));

        assertEquals(Instant.parse("2024-01-01T00:05:00Z"), serverClock.now());
    }
}
