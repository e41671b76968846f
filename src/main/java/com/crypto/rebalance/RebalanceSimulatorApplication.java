package com.crypto.rebalance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RebalanceSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RebalanceSimulatorApplication.class, args);
    }
}
