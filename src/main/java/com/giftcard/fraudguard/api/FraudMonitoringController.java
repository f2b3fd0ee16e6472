package com.giftcard.fraudguard.api;

import com.giftcard.fraudguard.alert.AlertBroadcaster;
import com.giftcard.fraudguard.cluster.ClusteringResult;
import com.giftcard.fraudguard.cluster.ThreatClusteringEngine;
import com.giftcard.fraudguard.domain.FraudCluster;
import com.giftcard.fraudguard.domain.FraudLog;
import com.giftcard.fraudguard.persistence.service.FraudClusterPersistenceService;
import com.giftcard.fraudguard.persistence.service.FraudLogStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * Admin API for fraud monitoring: recent fraud logs, statistics, threat clusters,
 * manual threat analysis and the live alert stream. Every endpoint requires the
 * {@code ADMIN} caller role.
 */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "Fraud Monitoring", description = "Fraud logs, threat clusters and live alerts (admin only)")
public class FraudMonitoringController {

    private final FraudLogStore fraudLogStore;
    private final FraudClusterPersistenceService clusterService;
    private final ThreatClusteringEngine clusteringEngine;
    private final AlertBroadcaster alertBroadcaster;
    private final CallerAuthorizer callerAuthorizer;

    @GetMapping("/fraud-logs")
    @Operation(summary = "Recent fraud logs", description = "Newest first. limit defaults to 50, capped at 500.")
    public ResponseEntity<Map<String, Object>> fraudLogs(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @Parameter(description = "Max logs to return") @RequestParam(required = false) Integer limit) {
        callerAuthorizer.requireAdmin(role);
        List<FraudLog> logs = fraudLogStore.recent(limit);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "fraudLogs", logs,
                "total", logs.size()));
    }

    @GetMapping("/fraud-statistics")
    @Operation(summary = "Fraud statistics", description = "Totals, block rate, 24h activity, top threat types and hourly buckets")
    public ResponseEntity<Map<String, Object>> fraudStatistics(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role) {
        callerAuthorizer.requireAdmin(role);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "statistics", fraudLogStore.statistics()));
    }

    @GetMapping("/fraud-clusters")
    @Operation(summary = "Threat clusters", description = "Most recently updated first, with aggregate cluster stats")
    public ResponseEntity<Map<String, Object>> fraudClusters(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @Parameter(description = "Max clusters to return") @RequestParam(required = false) Integer limit) {
        callerAuthorizer.requireAdmin(role);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "clusters", clusterService.recent(limit),
                "stats", clusterService.stats()));
    }

    @GetMapping("/fraud-clusters/{clusterId}")
    @Operation(summary = "One threat cluster with its member patterns")
    public ResponseEntity<Map<String, Object>> fraudCluster(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @PathVariable String clusterId) {
        callerAuthorizer.requireAdmin(role);
        FraudCluster cluster = clusterService.findWithPatterns(clusterId)
                .orElseThrow(() -> new ClusterNotFoundException("Fraud cluster not found: " + clusterId));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "cluster", cluster));
    }

    @PostMapping("/threat-analysis/trigger")
    @Operation(summary = "Run threat analysis now", description = "Returns 409 when an analysis is already running")
    public ResponseEntity<Map<String, Object>> triggerAnalysis(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role) {
        callerAuthorizer.requireAdmin(role);
        ClusteringResult result = clusteringEngine.trigger();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Threat analysis completed",
                "result", result));
    }

    @GetMapping("/threat-analysis/status")
    @Operation(summary = "Threat analysis engine status")
    public ResponseEntity<Map<String, Object>> analysisStatus(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role) {
        callerAuthorizer.requireAdmin(role);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "status", clusteringEngine.status()));
    }

    @GetMapping(value = "/alerts/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live alert stream", description = "Server-sent events: fraud-alert, fraud-cluster, transaction-feed")
    public SseEmitter alertStream(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role) {
        callerAuthorizer.requireAdmin(role);
        log.debug("Alert stream subscriber connected, {} active", alertBroadcaster.subscriberCount() + 1);
        return alertBroadcaster.subscribe();
    }
}
