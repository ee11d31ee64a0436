package com.flagship.recycling_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RecyclingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecyclingLedgerApplication.class, args);
    }
}
