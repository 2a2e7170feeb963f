package com.waqiti.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bridge Service - validator consensus and transfer lifecycle for cross-ledger transfers
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class BridgeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeServiceApplication.class, args);
    }
}
