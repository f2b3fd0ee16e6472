package com.giftcard.fraudguard.core.replay;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the shared redeemed-code record. Only created when the Redis-backed
 * stores are selected.
 */
@Configuration
@ConditionalOnProperty(name = "fraudguard.store.type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisTemplate<String, RedeemedCodeRecord> redeemedCodeRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, RedeemedCodeRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new RedeemedCodeRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new RedeemedCodeRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
