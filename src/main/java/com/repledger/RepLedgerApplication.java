package com.repledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class RepLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepLedgerApplication.class, args);
    }
}
