package com.giftcard.fraudguard;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

/**
 * Integration test: verifies that the fraud guard application context loads with the
 * Redis-backed stores and Kafka publishing switched on. Requires PostgreSQL, Redis and
 * Kafka (e.g. docker-compose up -d), so the default build excludes the integration tag.
 * Run with:
 *   mvn test -Dgroups=integration -Dexcluded.test.groups=
 */
@Tag("integration")
@SpringBootTest(classes = FraudGuardApplication.class)
@TestPropertySource(properties = {
		"fraudguard.store.type=redis",
		"fraudguard.kafka.enabled=true",
		"spring.kafka.bootstrap-servers=localhost:9092",
		"spring.data.redis.host=localhost",
		"spring.data.redis.port=6379"
})
class FraudGuardApplicationTests {

	@Test
	void contextLoads() {
	}
}
