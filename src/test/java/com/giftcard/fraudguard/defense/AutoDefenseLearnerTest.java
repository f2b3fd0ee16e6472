package com.giftcard.fraudguard.defense;

import com.giftcard.fraudguard.MutableClock;
import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.domain.DefenseRule;
import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutoDefenseLearnerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private DefenseRuleService ruleService;

    private AutoDefenseLearner learner;

    @BeforeEach
    void setUp() {
        learner = new AutoDefenseLearner(ruleService, new FraudGuardProperties(), new MutableClock(T0));
        lenient().when(ruleService.enforce(any()))
                .thenAnswer(invocation -> new DefenseRuleChange(invocation.getArgument(0), true));
    }

    private static ReplayResult event(String ip, String device, String merchant, ReplayOutcome outcome) {
        boolean fraudulent = outcome == ReplayOutcome.BLOCKED_CORRECTLY || outcome == ReplayOutcome.SHOULD_HAVE_BLOCKED;
        return ReplayResult.builder()
                .ipAddress(ip)
                .deviceFingerprint(device)
                .merchantId(merchant)
                .fraudulent(fraudulent)
                .outcome(outcome)
                .build();
    }

    private static ThreatReplayReport report(List<ReplayResult> results) {
        int caught = (int) results.stream().filter(r -> r.getOutcome() == ReplayOutcome.BLOCKED_CORRECTLY).count();
        int missed = (int) results.stream().filter(r -> r.getOutcome() == ReplayOutcome.SHOULD_HAVE_BLOCKED).count();
        return ThreatReplayReport.builder()
                .totalReplayed(results.size())
                .blockedCorrectly(caught)
                .shouldHaveBlocked(missed)
                .results(results)
                .build();
    }

    @Test
    void mostlyFraudulentIpIsBlockedWithRateScaledConfidence() {
        List<ReplayResult> events = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            events.add(event("203.0.113.5", "dev-" + i, null, ReplayOutcome.SHOULD_HAVE_BLOCKED));
        }
        events.add(event("203.0.113.5", "dev-9", null, ReplayOutcome.IGNORED));

        LearningResult result = learner.learn(report(events));

        ArgumentCaptor<DefenseRule> captor = ArgumentCaptor.forClass(DefenseRule.class);
        verify(ruleService).enforce(captor.capture());
        DefenseRule rule = captor.getValue();
        assertThat(rule.getTarget()).isEqualTo(DefenseTarget.IP);
        assertThat(rule.getValue()).isEqualTo("203.0.113.5");
        assertThat(rule.getOrigin()).isEqualTo(DefenseRuleOrigin.THREAT_REPLAY);
        // 50 + 0.75 * 45
        assertThat(rule.getConfidence()).isEqualTo(84);
        assertThat(rule.getExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
        assertThat(result.getRulesCreated()).isEqualTo(1);
        assertThat(result.getLearningEffectiveness()).isZero();
    }

    @Test
    void tooFewObservationsLearnNothing() {
        LearningResult result = learner.learn(report(List.of(
                event("203.0.113.5", "dev-1", null, ReplayOutcome.SHOULD_HAVE_BLOCKED),
                event("203.0.113.5", "dev-2", null, ReplayOutcome.SHOULD_HAVE_BLOCKED))));

        verify(ruleService, never()).enforce(any());
        assertThat(result.getRules()).isEmpty();
    }

    @Test
    void deviceWithManyFraudulentEventsIsBlockedAcrossIps() {
        List<ReplayResult> events = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            events.add(event("198.51.100." + i, "dev-farm", null, ReplayOutcome.SHOULD_HAVE_BLOCKED));
        }
        for (int i = 0; i < 2; i++) {
            events.add(event("198.51.100." + (10 + i), "dev-farm", null, ReplayOutcome.IGNORED));
        }

        learner.learn(report(events));

        verify(ruleService).enforce(argThat(r -> r.getTarget() == DefenseTarget.DEVICE && r.getValue().equals("dev-farm")));
    }

    @Test
    void merchantNeedsBothHighRateAndVolume() {
        List<ReplayResult> events = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            events.add(event("192.0.2." + i, "d-" + i, "m-bad", ReplayOutcome.BLOCKED_CORRECTLY));
        }
        for (int i = 0; i < 5; i++) {
            events.add(event("192.0.2." + (20 + i), "e-" + i, "m-small", ReplayOutcome.BLOCKED_CORRECTLY));
        }

        LearningResult result = learner.learn(report(events));

        verify(ruleService, times(1)).enforce(argThat(r -> r.getTarget() == DefenseTarget.MERCHANT));
        verify(ruleService).enforce(argThat(r -> r.getTarget() == DefenseTarget.MERCHANT && r.getValue().equals("m-bad")));
        assertThat(result.getLearningEffectiveness()).isEqualTo(100.0);
    }

    @Test
    void existingRuleIsCountedAsUpdated() {
        when(ruleService.enforce(any())).thenAnswer(invocation -> new DefenseRuleChange(invocation.getArgument(0), false));
        List<ReplayResult> events = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            events.add(event("203.0.113.5", null, null, ReplayOutcome.BLOCKED_CORRECTLY));
        }

        LearningResult result = learner.learn(report(events));

        assertThat(result.getRulesCreated()).isZero();
        assertThat(result.getRulesUpdated()).isEqualTo(1);
    }
}
