package com.giftcard.fraudguard.core.replay;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * Serializes {@link RedeemedCodeRecord} to/from plain JSON for Redis (ISO-8601 instants,
 * no @class type info).
 */
public class RedeemedCodeRedisSerializer implements RedisSerializer<RedeemedCodeRecord> {

    private final ObjectMapper mapper;

    public RedeemedCodeRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(RedeemedCodeRecord value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize RedeemedCodeRecord", e);
        }
    }

    @Override
    public RedeemedCodeRecord deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), RedeemedCodeRecord.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize RedeemedCodeRecord", e);
        }
    }
}
