package com.invoice.chargemap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChargeMappingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChargeMappingApplication.class, args);
    }
}
