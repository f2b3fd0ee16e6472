package com.giftcard.fraudguard.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Aggregate metrics over the member logs of a cluster.
 */
@Value
@Builder
@Jacksonized
public class ClusterMetadata {

    @JsonProperty("uniqueIPs")
    int uniqueIps;
    int uniqueDevices;
    long timeSpanMs;
    /** Sorted, distinct failure reasons of the member logs. */
    List<FailureReason> threatTypes;
}
