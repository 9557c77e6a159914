package com.pharmacy.fraud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FraudRankingApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudRankingApplication.class, args);
    }
}
