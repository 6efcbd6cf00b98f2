package com.flagship.escrow_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EscrowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowEngineApplication.class, args);
    }
}
