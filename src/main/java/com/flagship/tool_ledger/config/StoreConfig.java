package com.flagship.tool_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tool_ledger.store.DocumentStore;
import com.flagship.tool_ledger.store.InMemoryDocumentStore;
import com.flagship.tool_ledger.store.JdbcDocumentStore;
import com.flagship.tool_ledger.store.ServerClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the document store implementation.
 *
 * store.type=jdbc (default) uses PostgreSQL; store.type=memory keeps everything in
 * process and is meant for local runs and tests.
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean
    public ServerClock serverClock() {
        return ServerClock.system();
    }

    @Bean
    @ConditionalOnProperty(name = "store.type", havingValue = "jdbc", matchIfMissing = true)
    public DocumentStore jdbcDocumentStore(JdbcTemplate jdbcTemplate,
                                           PlatformTransactionManager transactionManager,
                                           ObjectMapper objectMapper,
                                           ServerClock serverClock,
                                           @Value("${store.transaction.max-attempts:5}") int maxAttempts) {
        log.info("Using JDBC document store (maxAttempts={})", maxAttempts);
        return new JdbcDocumentStore(jdbcTemplate, new TransactionTemplate(transactionManager),
            objectMapper, serverClock, maxAttempts);
    }

    @Bean
    @ConditionalOnProperty(name = "store.type", havingValue = "memory")
    public DocumentStore inMemoryDocumentStore(ServerClock serverClock,
                                               @Value("${store.transaction.max-attempts:5}") int maxAttempts,
                                               @Value("${store.memory.atomic-array-append:true}") boolean atomicArrayAppend) {
        log.info("Using in-memory document store (maxAttempts={}, atomicArrayAppend={})",
            maxAttempts, atomicArrayAppend);
        return new InMemoryDocumentStore(serverClock, maxAttempts, atomicArrayAppend);
    }
}
