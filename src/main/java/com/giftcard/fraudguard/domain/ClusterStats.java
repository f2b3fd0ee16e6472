package com.giftcard.fraudguard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ClusterStats {

    long totalClusters;
    /** Clusters created in the last 24 hours. */
    long recentClusters;
    double avgSeverity;
    /** Cluster count per pattern type wire name. */
    Map<String, Long> patternTypes;
}
