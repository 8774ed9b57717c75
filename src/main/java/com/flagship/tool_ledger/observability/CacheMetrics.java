package com.flagship.tool_ledger.observability;

import com.flagship.tool_ledger.inventory.ItemStatusCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gauges over the item status cache: how many items it holds and how old its last
 * full reload is. A growing age means reloads are failing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheMetrics {

    private final ItemStatusCache cache;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void init() {
        Gauge.builder("inventory.cache.size", cache, ItemStatusCache::size)
                .description("Tools and consumables held by the item status cache")
                .register(meterRegistry);

        Gauge.builder("inventory.cache.age.seconds", cache, c -> c.age().toMillis() / 1000.0)
                .description("Seconds since the item status cache was last fully reloaded")
                .register(meterRegistry);

        log.info("Item status cache gauges registered");
    }
}
