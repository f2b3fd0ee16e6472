package com.giftcard.fraudguard.cluster;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ClusteringStatus {

    boolean enabled;
    boolean running;
    Instant lastRunStartedAt;
    Instant lastRunCompletedAt;
    ClusteringResult lastResult;
    long totalClusters;
    long recentClusters;
    double avgSeverity;
    Map<String, Long> patternTypes;
}
