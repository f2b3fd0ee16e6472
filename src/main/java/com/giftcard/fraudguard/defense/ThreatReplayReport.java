package com.giftcard.fraudguard.defense;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ThreatReplayReport {

    int totalReplayed;
    int blockedCorrectly;
    int shouldHaveBlocked;
    int falsePositives;
    int ignored;
    /** Share of events the rules in force treat correctly, 0..1, four decimals. */
    double accuracy;
    Instant replayedAt;
    List<ReplayResult> results;
}
