package com.giftcard.fraudguard.cluster;

import lombok.Value;

import java.util.List;

@Value
public class GroupingResult {

    List<ClusterCandidate> candidates;
    /** Rows ignored for a missing id, timestamp or failure reason. */
    int skippedRows;
    /** Well-formed rows not already assigned to a cluster. */
    int threatsAnalyzed;
}
