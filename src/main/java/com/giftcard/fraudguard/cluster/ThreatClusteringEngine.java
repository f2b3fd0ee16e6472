package com.giftcard.fraudguard.cluster;

import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.alert.AlertEventType;
import com.giftcard.fraudguard.api.ClusteringBusyException;
import com.giftcard.fraudguard.config.FraudGuardProperties;
import com.giftcard.fraudguard.defense.ClusterDefensePolicy;
import com.giftcard.fraudguard.domain.ClusterStats;
import com.giftcard.fraudguard.domain.FraudCluster;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.persistence.service.FraudClusterPersistenceService;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Periodic batch job that turns recent fraud logs into clusters. One run at a time:
 * scheduled runs skip while another run holds the lock, manual triggers wait a bounded
 * time and then report busy.
 * <p>
 * A run reads the look-back window of logs (bounded by the read timeout), groups them
 * with {@link ThreatClusterer}, then creates or extends clusters one transaction per
 * group until the run deadline. Groups left over are picked up by the next run. Each
 * created or grown cluster is handed to the {@link ClusterDefensePolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreatClusteringEngine {

    private final FraudLogStore fraudLogStore;
    private final FraudClusterPersistenceService clusterService;
    private final ThreatClusterer clusterer;
    private final AlertBroadcaster alertBroadcaster;
    private final ClusterDefensePolicy defensePolicy;
    private final FraudGuardProperties properties;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private final ExecutorService readExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "clustering-read");
        t.setDaemon(true);
        return t;
    });

    private TimeLimiter readLimiter;
    private volatile Instant lastRunStartedAt;
    private volatile Instant lastRunCompletedAt;
    private volatile ClusteringResult lastResult;

    @PostConstruct
    void init() {
        FraudGuardProperties.Clustering c = properties.getClustering();
        readLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(c.getReadTimeout())
                .cancelRunningFuture(true)
                .build());
        log.info("ThreatClusteringEngine configured: enabled={}, interval={}, lookBack={}, readTimeout={}, runTimeout={}, maxLogsPerRun={}",
                c.isEnabled(), c.getInterval(), c.getLookBack(), c.getReadTimeout(), c.getRunTimeout(), c.getMaxLogsPerRun());
    }

    @PreDestroy
    void shutdown() {
        readExecutor.shutdownNow();
    }

    @Scheduled(fixedDelayString = "${fraudguard.clustering.interval:PT5M}",
            initialDelayString = "${fraudguard.clustering.initial-delay:PT30S}")
    public void runScheduled() {
        if (!properties.getClustering().isEnabled()) {
            return;
        }
        if (!runLock.tryLock()) {
            log.info("Threat clustering run skipped: previous run still active");
            return;
        }
        try {
            runLocked();
        } catch (Exception e) {
            log.error("Threat clustering run failed, will retry on next schedule", e);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Run now. Waits up to the trigger wait for a running analysis to finish.
     *
     * @throws ClusteringBusyException if the run lock cannot be acquired in time
     */
    public ClusteringResult trigger() {
        Duration wait = properties.getClustering().getTriggerWait();
        boolean acquired;
        try {
            acquired = runLock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusteringBusyException("Interrupted while waiting for the running threat analysis", e);
        }
        if (!acquired) {
            throw new ClusteringBusyException("Threat analysis already running, try again later");
        }
        try {
            log.info("Manual threat analysis triggered");
            return runLocked();
        } finally {
            runLock.unlock();
        }
    }

    public ClusteringStatus status() {
        ClusterStats stats = clusterService.stats();
        return ClusteringStatus.builder()
                .enabled(properties.getClustering().isEnabled())
                .running(runLock.isLocked())
                .lastRunStartedAt(lastRunStartedAt)
                .lastRunCompletedAt(lastRunCompletedAt)
                .lastResult(lastResult)
                .totalClusters(stats.getTotalClusters())
                .recentClusters(stats.getRecentClusters())
                .avgSeverity(stats.getAvgSeverity())
                .patternTypes(stats.getPatternTypes())
                .build();
    }

    private ClusteringResult runLocked() {
        FraudGuardProperties.Clustering config = properties.getClustering();
        String runId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        Instant deadline = started.plus(config.getRunTimeout());
        Instant since = started.minus(config.getLookBack());
        lastRunStartedAt = started;

        WorkingSet workingSet;
        try {
            workingSet = readLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> readWorkingSet(since), readExecutor));
        } catch (TimeoutException e) {
            log.warn("Threat clustering run {} aborted: log read exceeded {}", runId, config.getReadTimeout());
            return finish(ClusteringResult.builder().runId(runId).aborted(true).startedAt(started));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read fraud logs for clustering", e);
        }

        GroupingResult grouping = clusterer.group(workingSet.rows(), workingSet.assigned(), workingSet.openClusters());
        int created = 0;
        int updated = 0;
        int deferred = 0;
        List<ClusterCandidate> candidates = grouping.getCandidates();
        for (int i = 0; i < candidates.size(); i++) {
            if (clock.instant().isAfter(deadline)) {
                deferred = candidates.size() - i;
                log.warn("Threat clustering run {} hit its deadline; {} groups deferred to the next run", runId, deferred);
                break;
            }
            ClusterCandidate candidate = candidates.get(i);
            try {
                FraudCluster cluster = candidate.isMerge()
                        ? clusterService.merge(candidate, runId)
                        : clusterService.create(candidate, runId);
                if (candidate.isMerge()) updated++;
                else created++;
                alertBroadcaster.publish(AlertEventType.FRAUD_CLUSTER, cluster);
                applyDefensePolicy(cluster);
            } catch (DataIntegrityViolationException e) {
                log.warn("Cluster group {}:{} skipped, a member log is already assigned: {}",
                        candidate.getPatternType().getWireName(), candidate.getGroupKey(), e.getMessage());
            }
        }

        log.info("Threat clustering run {} completed: analyzed={}, created={}, updated={}, skipped={}, deferred={}",
                runId, grouping.getThreatsAnalyzed(), created, updated, grouping.getSkippedRows(), deferred);
        return finish(ClusteringResult.builder()
                .runId(runId)
                .clustersFound(created + updated)
                .threatsAnalyzed(grouping.getThreatsAnalyzed())
                .clustersCreated(created)
                .clustersUpdated(updated)
                .skippedRows(grouping.getSkippedRows())
                .deferredGroups(deferred)
                .startedAt(started));
    }

    /** A failed defense write never fails the run; the next growth of the cluster retries it. */
    private void applyDefensePolicy(FraudCluster cluster) {
        try {
            defensePolicy.apply(cluster);
        } catch (RuntimeException e) {
            log.error("Defense policy failed for cluster {}", cluster.getId(), e);
        }
    }

    private WorkingSet readWorkingSet(Instant since) {
        Instant openSince = since.minus(maxGroupingWindow());
        return new WorkingSet(
                fraudLogStore.findUnclusteredSince(since),
                clusterService.findAssignedFraudLogIds(since),
                clusterService.findOpenClusters(openSince));
    }

    private Duration maxGroupingWindow() {
        FraudGuardProperties.Clustering c = properties.getClustering();
        return Stream.of(c.getIp(), c.getDevice(), c.getVelocity(), c.getUserAgent())
                .map(FraudGuardProperties.Grouping::getWindow)
                .max(Duration::compareTo)
                .orElse(Duration.ZERO);
    }

    private ClusteringResult finish(ClusteringResult.ClusteringResultBuilder builder) {
        Instant completed = clock.instant();
        ClusteringResult result = builder.completedAt(completed).build();
        lastRunCompletedAt = completed;
        lastResult = result;
        return result;
    }

    private record WorkingSet(List<FraudLog> rows, Set<String> assigned, List<FraudCluster> openClusters) {}
}
