package com.giftcard.fraudguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable policy values of the redemption guard and the clustering engine. Every value
 * here is a default, not a contract: override with {@code fraudguard.*} properties or the
 * equivalent environment variables (e.g. {@code FRAUDGUARD_RATELIMIT_IP_LIMIT}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fraudguard")
public class FraudGuardProperties {

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    @Valid
    private final Replay replay = new Replay();

    private final Fingerprint fingerprint = new Fingerprint();

    @Valid
    private final Upstream upstream = new Upstream();

    @Valid
    private final Clustering clustering = new Clustering();

    @Valid
    private final Defense defense = new Defense();

    @Getter
    @Setter
    public static class RateLimit {
        /** Redemption attempts per IP. */
        @Valid
        private Policy ip = new Policy(3, Duration.ofSeconds(60));

        /** Hard flood limit per device, all attempts. */
        @Valid
        private Policy device = new Policy(10, Duration.ofMinutes(10));

        /** Failed attempts per device before the device is flagged SUSPICIOUS_ACTIVITY and blocked. */
        @Valid
        private DeviceFailures deviceFailures = new DeviceFailures();

        /** Redemption attempts per merchant. */
        @Valid
        private Policy merchant = new Policy(10, Duration.ofMinutes(5));

        /** How often the in-memory store sweeps idle windows. */
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Policy {
        @Min(1)
        private int limit;

        @NotNull
        private Duration window;

        public Policy() {
        }

        public Policy(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }
    }

    @Getter
    @Setter
    public static class DeviceFailures extends Policy {
        /** A success from a device with at least this many recent failures is logged as suspicious. */
        @Min(1)
        private int softThreshold = 2;

        public DeviceFailures() {
            super(5, Duration.ofMinutes(10));
        }
    }

    @Getter
    @Setter
    public static class Fingerprint {
        /**
         * Peers whose X-Forwarded-For and X-Real-IP headers are believed. Empty means the
         * headers are taken from any peer, which is only safe behind a proxy that overwrites them.
         */
        private List<String> trustedProxies = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Replay {
        /** Abandoned reservations are released after this long. */
        @NotNull
        private Duration reservationTtl = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Upstream {
        /** Bound on every call to the gift-card store. On timeout the guard fails closed. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Clustering {
        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofMinutes(5);

        @NotNull
        private Duration lookBack = Duration.ofHours(24);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration runTimeout = Duration.ofSeconds(60);

        /** How long a manual trigger waits for a running analysis before reporting busy. */
        @NotNull
        private Duration triggerWait = Duration.ofSeconds(30);

        @Min(1)
        private int maxLogsPerRun = 5000;

        @Valid
        private Grouping ip = new Grouping(Duration.ofMinutes(15), 3);

        @Valid
        private Grouping device = new Grouping(Duration.ofMinutes(15), 3);

        @Valid
        private Grouping velocity = new Grouping(Duration.ofSeconds(10), 3);

        @Valid
        private UserAgentGrouping userAgent = new UserAgentGrouping();
    }

    @Getter
    @Setter
    public static class Grouping {
        /** Max gap between consecutive logs of one group. */
        @NotNull
        private Duration window;

        @Min(2)
        private int minThreatCount;

        public Grouping() {
        }

        public Grouping(Duration window, int minThreatCount) {
            this.window = window;
            this.minThreatCount = minThreatCount;
        }
    }

    @Getter
    @Setter
    public static class UserAgentGrouping extends Grouping {
        @Min(1)
        private int minDistinctIps = 2;

        /** User agents shorter than this are treated as unusual. */
        @Min(0)
        private int shortLength = 20;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarity = 0.9;

        public UserAgentGrouping() {
            super(Duration.ofMinutes(15), 3);
        }
    }

    @Getter
    @Setter
    public static class Defense {
        /** When off, rules are still recorded but the guard ignores them. */
        private boolean enabled = true;

        /** How often the guard's rule cache reloads from the database and flushes hit counts. */
        @NotNull
        private Duration refreshInterval = Duration.ofSeconds(30);

        /** Fraud logs replayed when the admin request names no limit. */
        @Min(1)
        @Max(500)
        private int replayLimit = 50;

        /** Lifetime of a rule learned from replay. */
        @NotNull
        private Duration learnedRuleTtl = Duration.ofDays(7);

        /** Replayed events an IP or device needs before a rule is learned for it. */
        @Min(1)
        private int minObservations = 3;

        @Valid
        private ClusterPolicy clusterPolicy = new ClusterPolicy();
    }

    /**
     * Blocks raised from clusters. Block length grows with cluster severity up to the cap.
     */
    @Getter
    @Setter
    public static class ClusterPolicy {
        @Min(1)
        @Max(5)
        private int ipBlockMinSeverity = 4;

        @NotNull
        private Duration ipBlockPerSeverity = Duration.ofHours(4);

        @NotNull
        private Duration ipBlockMax = Duration.ofHours(24);

        @DecimalMin("0.0")
        @DecimalMax("10.0")
        private double deviceBlockMinScore = 8.0;

        @NotNull
        private Duration deviceBlockPerSeverity = Duration.ofDays(1);

        @NotNull
        private Duration deviceBlockMax = Duration.ofDays(7);
    }
}
