package com.flagship.tool_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ToolLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolLedgerApplication.class, args);
    }
}
