package com.giftcard.fraudguard.alert;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Envelope pushed to live monitoring sessions and, when enabled, to Kafka.
 */
@Value
@Builder
@Jacksonized
public class AlertEvent {

    String eventId;
    AlertEventType type;
    /** FraudLog, FraudCluster or TransactionFeedItem. */
    Object payload;
    Instant timestamp;
}
