package com.giftcard.fraudguard.cluster;

import com.giftcard.fraudguard.domain.FraudCluster;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.PatternType;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A group of not-yet-clustered logs found in one run, either a new cluster or an
 * extension of an open one.
 */
@Value
public class ClusterCandidate {

    PatternType patternType;
    String groupKey;
    /** Open cluster to merge into; null for a new cluster. */
    FraudCluster target;
    /** New member logs, oldest first. */
    List<FraudLog> members;
    /** Similarity per fraud log id. */
    Map<String, Double> similarities;

    public boolean isMerge() {
        return target != null;
    }
}
