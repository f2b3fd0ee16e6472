package com.giftcard.fraudguard.cluster;

import com.giftcard.fraudguard.MutableClock;
import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.alert.AlertEventType;
import com.giftcard.fraudguard.api.ClusteringBusyException;
import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.defense.ClusterDefensePolicy;
import com.giftcard.fraudguard.domain.ClusterStats;
import com.giftcard.fraudguard.domain.FraudCluster;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.domain.PatternType;
import com.giftcard.fraudguard.persistence.service.FraudClusterPersistenceService;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static com.giftcard.fraudguard.cluster.ClusterTestLogs.BROWSER_UA;
import static com.giftcard.fraudguard.cluster.ClusterTestLogs.T0;
import static com.giftcard.fraudguard.cluster.ClusterTestLogs.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ThreatClusteringEngine with a real clusterer and mocked persistence.
 */
@ExtendWith(MockitoExtension.class)
class ThreatClusteringEngineTest {

    @Mock
    private FraudLogStore fraudLogStore;

    @Mock
    private FraudClusterPersistenceService clusterService;

    @Mock
    private AlertBroadcaster alertBroadcaster;

    @Mock
    private ClusterDefensePolicy defensePolicy;

    private FraudGuardProperties properties;
    private MutableClock clock;
    private ThreatClusteringEngine engine;

    @BeforeEach
    void setUp() {
        properties = new FraudGuardProperties();
        properties.getClustering().setTriggerWait(Duration.ofMillis(100));
        clock = new MutableClock(T0.plusSeconds(600));
        engine = new ThreatClusteringEngine(fraudLogStore, clusterService, new ThreatClusterer(properties),
                alertBroadcaster, defensePolicy, properties, clock);
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void givenWorkingSet(List<FraudLog> rows) {
        when(fraudLogStore.findUnclusteredSince(any())).thenReturn(rows);
        when(clusterService.findAssignedFraudLogIds(any())).thenReturn(Set.of());
        when(clusterService.findOpenClusters(any())).thenReturn(List.of());
    }

    @Test
    void triggerCreatesClusterForThreeLogsFromOneIp() {
        givenWorkingSet(List.of(
                row("l1", "203.0.113.5", "dev-a", BROWSER_UA, 0),
                row("l2", "203.0.113.5", "dev-b", BROWSER_UA, 120),
                row("l3", "203.0.113.5", "dev-c", BROWSER_UA, 240)));
        FraudCluster created = FraudCluster.builder()
                .id("c-1")
                .patternType(PatternType.IP_BASED)
                .groupKey("203.0.113.5")
                .threatCount(3)
                .build();
        when(clusterService.create(any(), anyString())).thenReturn(created);

        ClusteringResult result = engine.trigger();

        ArgumentCaptor<ClusterCandidate> captor = ArgumentCaptor.forClass(ClusterCandidate.class);
        verify(clusterService).create(captor.capture(), eq(result.getRunId()));
        assertThat(captor.getValue().getMembers()).hasSize(3);
        assertThat(result.getClustersFound()).isEqualTo(1);
        assertThat(result.getClustersCreated()).isEqualTo(1);
        assertThat(result.getThreatsAnalyzed()).isEqualTo(3);
        assertThat(result.isAborted()).isFalse();
        verify(alertBroadcaster).publish(AlertEventType.FRAUD_CLUSTER, created);
        verify(defensePolicy).apply(created);
    }

    @Test
    void defensePolicyFailureDoesNotFailTheRun() {
        givenWorkingSet(List.of(
                row("l1", "203.0.113.5", "dev-a", BROWSER_UA, 0),
                row("l2", "203.0.113.5", "dev-b", BROWSER_UA, 120),
                row("l3", "203.0.113.5", "dev-c", BROWSER_UA, 240)));
        FraudCluster created = FraudCluster.builder()
                .id("c-1")
                .patternType(PatternType.IP_BASED)
                .groupKey("203.0.113.5")
                .threatCount(3)
                .build();
        when(clusterService.create(any(), anyString())).thenReturn(created);
        when(defensePolicy.apply(created)).thenThrow(new IllegalStateException("defense_rules unavailable"));

        ClusteringResult result = engine.trigger();

        assertThat(result.getClustersCreated()).isEqualTo(1);
        assertThat(result.isAborted()).isFalse();
    }

    @Test
    void mergeCandidatesUpdateExistingCluster() {
        FraudCluster open = FraudCluster.builder()
                .id("c-1")
                .patternType(PatternType.IP_BASED)
                .groupKey("203.0.113.5")
                .lastSeenAt(T0.minusSeconds(60))
                .build();
        when(fraudLogStore.findUnclusteredSince(any())).thenReturn(List.of(row("l9", "203.0.113.5", "dev-z", BROWSER_UA, 0)));
        when(clusterService.findAssignedFraudLogIds(any())).thenReturn(Set.of());
        when(clusterService.findOpenClusters(any())).thenReturn(List.of(open));
        when(clusterService.merge(any(), anyString())).thenReturn(open);

        ClusteringResult result = engine.trigger();

        assertThat(result.getClustersUpdated()).isEqualTo(1);
        assertThat(result.getClustersCreated()).isZero();
        verify(clusterService, never()).create(any(), anyString());
        verify(defensePolicy).apply(open);
    }

    @Test
    void malformedRowsAreSkippedWithoutFailingTheRun() {
        List<FraudLog> rows = new ArrayList<>();
        rows.add(FraudLog.builder().id("broken").build());
        rows.add(row("l1", "203.0.113.5", "dev-a", BROWSER_UA, 0));
        givenWorkingSet(rows);

        ClusteringResult result = engine.trigger();

        assertThat(result.getSkippedRows()).isEqualTo(1);
        assertThat(result.getThreatsAnalyzed()).isEqualTo(1);
        assertThat(result.getClustersFound()).isZero();
    }

    @Test
    void integrityViolationSkipsOnlyThatGroup() {
        givenWorkingSet(List.of(
                row("l1", "203.0.113.5", "dev-a", BROWSER_UA, 0),
                row("l2", "203.0.113.5", "dev-b", BROWSER_UA, 60),
                row("l3", "203.0.113.5", "dev-c", BROWSER_UA, 120)));
        when(clusterService.create(any(), anyString()))
                .thenThrow(new DataIntegrityViolationException("uk_cluster_pattern_fraud_log"));

        ClusteringResult result = engine.trigger();

        assertThat(result.getClustersCreated()).isZero();
        verify(alertBroadcaster, never()).publish(eq(AlertEventType.FRAUD_CLUSTER), any());
    }

    @Test
    void triggerReportsBusyWhileAnotherRunHoldsTheLock() throws Exception {
        ReentrantLock runLock = (ReentrantLock) ReflectionTestUtils.getField(engine, "runLock");
        ExecutorService other = Executors.newSingleThreadExecutor();
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            other.submit(() -> {
                runLock.lock();
                try {
                    locked.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    runLock.unlock();
                }
            });
            assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> engine.trigger()).isInstanceOf(ClusteringBusyException.class);
            engine.runScheduled();
            verify(fraudLogStore, never()).findUnclusteredSince(any());
        } finally {
            release.countDown();
            other.shutdown();
        }
    }

    @Test
    void disabledEngineSkipsScheduledRuns() {
        properties.getClustering().setEnabled(false);

        engine.runScheduled();

        verify(fraudLogStore, never()).findUnclusteredSince(any());
    }

    @Test
    void scheduledRunSurvivesReadFailure() {
        when(fraudLogStore.findUnclusteredSince(any())).thenThrow(new IllegalStateException("db down"));
        when(clusterService.stats()).thenReturn(ClusterStats.builder().patternTypes(Map.of()).build());

        engine.runScheduled();

        assertThat(engine.status().getLastResult()).isNull();
    }

    @Test
    void statusReportsLastRunAndClusterStats() {
        givenWorkingSet(List.of());
        when(clusterService.stats()).thenReturn(ClusterStats.builder()
                .totalClusters(4)
                .recentClusters(1)
                .avgSeverity(2.5)
                .patternTypes(Map.of("ip_based", 4L))
                .build());

        ClusteringResult result = engine.trigger();
        ClusteringStatus status = engine.status();

        assertThat(status.isEnabled()).isTrue();
        assertThat(status.isRunning()).isFalse();
        assertThat(status.getLastResult()).isEqualTo(result);
        assertThat(status.getLastRunCompletedAt()).isEqualTo(clock.instant());
        assertThat(status.getTotalClusters()).isEqualTo(4);
        assertThat(status.getPatternTypes()).containsEntry("ip_based", 4L);
    }
}
