package com.flagship.tool_ledger.config;

import com.flagship.tool_ledger.history.PartitionKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
public class LedgerConfig {

    @Bean
    public PartitionKeys partitionKeys(@Value("${ledger.zone:UTC}") String zone,
                                       @Value("${ledger.query.max-month-partitions:24}") int maxMonthPartitions,
                                       @Value("${ledger.query.max-day-partitions:400}") int maxDayPartitions) {
        return new PartitionKeys(ZoneId.of(zone), maxMonthPartitions, maxDayPartitions);
    }
}
