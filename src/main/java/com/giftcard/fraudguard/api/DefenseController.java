package com.giftcard.fraudguard.api;

import com.giftcard.fraudguard.defense.AutoDefenseLearner;
import com.giftcard.fraudguard.defense.DefenseRuleService;
import com.giftcard.fraudguard.defense.LearningResult;
import com.giftcard.fraudguard.defense.ThreatReplayReport;
import com.giftcard.fraudguard.defense.ThreatReplayService;
import com.giftcard.fraudguard.domain.DefenseRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Admin API for auto-defense: threat replay with rule learning, the defense rules, the
 * actions raised from clusters and defense statistics.
 */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "Auto Defense", description = "Defense rules learned from clusters and threat replay (admin only)")
public class DefenseController {

    private final ThreatReplayService replayService;
    private final AutoDefenseLearner learner;
    private final DefenseRuleService ruleService;
    private final CallerAuthorizer callerAuthorizer;

    @PostMapping("/replay-threats")
    @Operation(summary = "Replay recent threats and learn rules",
            description = "Replays the most recent fraud logs against the rules in force, then creates or strengthens "
                    + "IP, device and merchant rules from the result. Body is optional: { limit } capped at 500.")
    public ResponseEntity<Map<String, Object>> replayThreats(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @Valid @RequestBody(required = false) ReplayThreatsRequestDto dto) {
        callerAuthorizer.requireAdmin(role);
        ThreatReplayReport replay = replayService.replay(dto != null ? dto.getLimit() : null);
        LearningResult learning = learner.learn(replay);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "replay", replay,
                "learning", learning,
                "message", "Replayed " + replay.getTotalReplayed() + " threats: " + learning.getRulesCreated()
                        + " rules created, " + learning.getRulesUpdated() + " updated"));
    }

    @GetMapping("/defense-rules")
    @Operation(summary = "Defense rules", description = "Newest first, including expired and deactivated rules. limit defaults to 100, capped at 500.")
    public ResponseEntity<Map<String, Object>> defenseRules(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @Parameter(description = "Max rules to return") @RequestParam(required = false) Integer limit) {
        callerAuthorizer.requireAdmin(role);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "rules", ruleService.rules(limit),
                "statistics", ruleService.stats()));
    }

    @DeleteMapping("/defense-rules/{ruleId}")
    @Operation(summary = "Deactivate a defense rule", description = "The guard stops enforcing it immediately. 404 for an unknown id.")
    public ResponseEntity<Map<String, Object>> deactivateRule(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @PathVariable String ruleId) {
        callerAuthorizer.requireAdmin(role);
        DefenseRule rule = ruleService.deactivate(ruleId)
                .orElseThrow(() -> new DefenseRuleNotFoundException("Defense rule not found"));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Defense rule deactivated successfully",
                "rule", rule));
    }

    @GetMapping("/defense-actions")
    @Operation(summary = "Blocks raised from threat clusters", description = "Newest first. limit defaults to 100, capped at 500.")
    public ResponseEntity<Map<String, Object>> defenseActions(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role,
            @Parameter(description = "Max actions to return") @RequestParam(required = false) Integer limit) {
        callerAuthorizer.requireAdmin(role);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "actions", ruleService.clusterActions(limit)));
    }

    @GetMapping("/defense-stats")
    @Operation(summary = "Defense statistics")
    public ResponseEntity<Map<String, Object>> defenseStats(
            @RequestHeader(value = CallerAuthorizer.ROLE_HEADER, required = false) String role) {
        callerAuthorizer.requireAdmin(role);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "stats", ruleService.stats()));
    }
}
