package com.eon.credit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CreditLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditLedgerApplication.class, args);
    }
}
