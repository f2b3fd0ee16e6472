package com.giftcard.fraudguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the gift-card fraud guard. Enables:
 * <ul>
 *   <li>Redemption guard: per IP, device and merchant rate limits plus replay protection</li>
 *   <li>Fraud logging (JPA) and scheduled threat clustering</li>
 *   <li>Live alerts over SSE, optional Kafka events and outbound webhook</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class FraudGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudGuardApplication.class, args);
    }
}
