package com.giftcard.fraudguard.cluster;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Summary of one clustering run.
 */
@Value
@Builder
@Jacksonized
public class ClusteringResult {

    String runId;
    /** Clusters created or extended in this run. */
    int clustersFound;
    int threatsAnalyzed;
    int clustersCreated;
    int clustersUpdated;
    /** Malformed fraud log rows that were ignored. */
    int skippedRows;
    /** Candidate groups left for the next run because the run deadline passed. */
    int deferredGroups;
    /** True when the log read timed out and nothing was written. */
    boolean aborted;
    Instant startedAt;
    Instant completedAt;
}
