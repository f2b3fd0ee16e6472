package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of the fraud log for the monitoring dashboard.
 */
@Value
@Builder
@Jacksonized
public class FraudStatistics {

    long totalAttempts;
    long blocked;
    /** blocked / totalAttempts, 0 when there are no logs. */
    double blockRate;
    long last24Hours;
    @JsonProperty("uniqueIPs24h")
    long uniqueIps24h;
    /** At most five reasons of the last 24 hours, most frequent first. */
    List<ReasonCount> topThreatTypes;
    /** 24 hourly buckets, oldest first, ending with the current hour. */
    List<HourlyBucket> hourlyBuckets;

    @Value
    @Builder
    @Jacksonized
    public static class ReasonCount {
        FailureReason reason;
        long count;
    }

    @Value
    @Builder
    @Jacksonized
    public static class HourlyBucket {
        Instant hourStart;
        long count;
    }
}
