package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A group of fraud logs sharing an identity (IP, device, user-agent signature) or a
 * burst in time. Score and severity only ever go up as the cluster absorbs new logs.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FraudCluster {

    String id;
    String label;
    PatternType patternType;
    String groupKey;
    /** 0..10, two decimals. */
    double score;
    /** 1..5. */
    int severity;
    int threatCount;
    ClusterMetadata metadata;
    Instant firstSeenAt;
    Instant lastSeenAt;
    Instant createdAt;
    Instant updatedAt;
    /** Only populated on the single-cluster detail view. */
    List<ClusterPattern> patterns;
}
