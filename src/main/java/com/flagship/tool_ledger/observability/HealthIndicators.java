package com.flagship.tool_ledger.observability;

import com.flagship.tool_ledger.store.DocumentStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the tool ledger.
 */
public class HealthIndicators {

    /**
     * The document store holds custody state; without it nothing works.
     */
    @Component("documentStoreHealth")
    public static class DocumentStoreHealthIndicator implements HealthIndicator {

        private final DocumentStore store;

        public DocumentStoreHealthIndicator(DocumentStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            boolean reachable = store.ping();
            return (reachable ? Health.up() : Health.down())
                    .withDetail("store", store.getClass().getSimpleName())
                    .build();
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage degrades rather than fails.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency keys are served from the document store";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up().withDetail("response", result).build();
                    }
                    return Health.status("DEGRADED")
                            .withDetail("response", result != null ? result : "null")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
