package com.giftcard.fraudguard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Membership of one fraud log in one cluster.
 */
@Value
@Builder
@Jacksonized
public class ClusterPattern {

    String id;
    String clusterId;
    String fraudLogId;
    double similarity;
    Snapshot metadata;
    String runId;

    /** Identity of the fraud log at the time it was clustered. */
    @Value
    @Builder
    @Jacksonized
    public static class Snapshot {
        String ipAddress;
        String userAgent;
        String deviceFingerprint;
        Instant timestamp;
    }
}
