package com.watchledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatchLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchLedgerApplication.class, args);
    }
}
