package com.flagship.value_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValueLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValueLedgerApplication.class, args);
    }
}
