package com.flagship.tool_ledger.store;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side timestamp source shared by every write path of a store.
 *
 * Successive calls never return the same or an earlier instant, even if the
 * wall clock stalls or steps backwards; ties are broken by one microsecond.
 */
public class ServerClock {

    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.EPOCH);

    public ServerClock(Clock clock) {
        this.clock = clock;
    }

    public static ServerClock system() {
        return new ServerClock(Clock.systemUTC());
    }

    public Instant now() {
        return last.updateAndGet(previous -> {
            Instant current = clock.instant();
            return current.isAfter(previous) ? current : previous.plus(1, ChronoUnit.MICROS);
        });
    }

    /**
     * Wall-clock reading without advancing the monotonic sequence; used for staleness checks.
     */
    public Instant peek() {
        return clock.instant();
    }
}
