package com.flagship.tool_ledger.inventory;

import com.flagship.tool_ledger.store.DocumentMapper;
import com.flagship.tool_ledger.store.DocumentSnapshot;
import com.flagship.tool_ledger.store.DocumentStore;
import com.flagship.tool_ledger.store.ServerClock;
import com.flagship.tool_ledger.store.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Local snapshot of the tools and consumables collections for scan-time checks.
 *
 * Writes made through this process arrive as push updates from the store subscription.
 * Writes from other processes are only picked up by a full reload, which happens
 * whenever the snapshot is older than {@code inventory.cache.max-staleness}, so while
 * the store is reachable reads never see data older than that bound.
 *
 * Push updates and reloads race freely. Every entry carries the store version it was
 * read at, and an entry is only ever replaced by a snapshot of the same or a newer
 * version, so a reload that listed a document before a concurrent push cannot roll the
 * entry back.
 *
 * This is never consulted by the custody transactions; they always re-read the store.
 */
@Component
@Slf4j
public class ItemStatusCache {

    private final DocumentStore store;
    private final DocumentMapper mapper;
    private final ServerClock clock;
    private final Duration maxStaleness;

    private final ConcurrentMap<String, Versioned<Tool>> tools = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Versioned<Consumable>> consumables = new ConcurrentHashMap<>();
    private volatile Instant loadedAt = Instant.EPOCH;
    private Subscription toolSubscription;
    private Subscription consumableSubscription;

    public ItemStatusCache(DocumentStore store,
                           DocumentMapper mapper,
                           ServerClock clock,
                           @Value("${inventory.cache.max-staleness:30s}") Duration maxStaleness) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.maxStaleness = maxStaleness;
    }

    @PostConstruct
    public void start() {
        toolSubscription = store.subscribe(Tool.COLLECTION, this::onToolChange);
        consumableSubscription = store.subscribe(Consumable.COLLECTION, this::onConsumableChange);
        reload();
    }

    @PreDestroy
    public void stop() {
        if (toolSubscription != null) {
            toolSubscription.cancel();
        }
        if (consumableSubscription != null) {
            consumableSubscription.cancel();
        }
    }

    public Optional<Tool> tool(String id) {
        refreshIfStale();
        return Optional.ofNullable(tools.get(id)).map(Versioned::item);
    }

    public Optional<Consumable> consumable(String id) {
        refreshIfStale();
        return Optional.ofNullable(consumables.get(id)).map(Versioned::item);
    }

    /**
     * Brings the snapshot up to the current store contents.
     */
    public synchronized void reload() {
        Instant started = clock.peek();
        Map<String, Versioned<Tool>> freshTools = new HashMap<>();
        for (DocumentSnapshot snapshot : store.list(Tool.COLLECTION)) {
            Tool tool = mapper.toObject(snapshot, Tool.class);
            freshTools.put(tool.getId(), new Versioned<>(tool, snapshot.getVersion(), started));
        }
        Map<String, Versioned<Consumable>> freshConsumables = new HashMap<>();
        for (DocumentSnapshot snapshot : store.list(Consumable.COLLECTION)) {
            Consumable consumable = mapper.toObject(snapshot, Consumable.class);
            freshConsumables.put(consumable.getId(), new Versioned<>(consumable, snapshot.getVersion(), started));
        }
        apply(tools, freshTools, started);
        apply(consumables, freshConsumables, started);
        loadedAt = started;
        log.debug("Item status cache reloaded: tools={}, consumables={}", tools.size(), consumables.size());
    }

    private static <T> void apply(ConcurrentMap<String, Versioned<T>> current,
                                  Map<String, Versioned<T>> listed, Instant listedAt) {
        // Entries pushed after the listing started may be newer than it; keep those
        current.entrySet().removeIf(entry -> !listed.containsKey(entry.getKey())
            && entry.getValue().receivedAt().isBefore(listedAt));
        listed.forEach((id, fresh) -> current.merge(id, fresh, ItemStatusCache::newer));
    }

    private static <T> Versioned<T> newer(Versioned<T> existing, Versioned<T> candidate) {
        return candidate.version() >= existing.version() ? candidate : existing;
    }

    @Scheduled(fixedDelayString = "${inventory.cache.refresh-interval-ms:10000}")
    public void refreshIfStale() {
        if (age().compareTo(maxStaleness) > 0) {
            try {
                reload();
            } catch (RuntimeException e) {
                // Stale entries stay readable; the next call tries again
                log.warn("Item status cache reload failed: {}", e.getMessage());
            }
        }
    }

    public Duration age() {
        return Duration.between(loadedAt, clock.peek());
    }

    public int size() {
        return tools.size() + consumables.size();
    }

    private void onToolChange(DocumentSnapshot snapshot) {
        if (snapshot.exists()) {
            Tool tool = mapper.toObject(snapshot, Tool.class);
            tools.merge(tool.getId(), new Versioned<>(tool, snapshot.getVersion(), clock.peek()), ItemStatusCache::newer);
        } else {
            tools.remove(snapshot.getRef().getId());
        }
    }

    private void onConsumableChange(DocumentSnapshot snapshot) {
        if (snapshot.exists()) {
            Consumable consumable = mapper.toObject(snapshot, Consumable.class);
            consumables.merge(consumable.getId(),
                new Versioned<>(consumable, snapshot.getVersion(), clock.peek()), ItemStatusCache::newer);
        } else {
            consumables.remove(snapshot.getRef().getId());
        }
    }

    private record Versioned<T>(T item, long version, Instant receivedAt) {}
}
