package com.finops.guard.controller;

import com.finops.guard.config.FinOpsGuardConfig;
import com.finops.guard.config.TeamsNotificationConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the active detection and pipeline configuration")
public class ConfigController {

    private final FinOpsGuardConfig config;
    private final TeamsNotificationConfig teamsConfig;

    public ConfigController(FinOpsGuardConfig config, TeamsNotificationConfig teamsConfig) {
        this.config = config;
        this.teamsConfig = teamsConfig;
    }

    @Operation(summary = "Get anomaly detection thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        FinOpsGuardConfig.Thresholds t = config.getThresholds();
        return ResponseEntity.ok(Map.of(
                "minAbsoluteDeltaUsd", t.getMinAbsoluteDeltaUsd(),
                "anomalyZscore", t.getAnomalyZscore(),
                "minHistoryPoints", t.getMinHistoryPoints(),
                "baselineDays", t.getBaselineDays()
        ));
    }

    @Operation(summary = "Get ingestion, schedule and notification settings (read-only)")
    @GetMapping("/pipeline")
    public ResponseEntity<Map<String, Object>> getPipeline() {
        return ResponseEntity.ok(Map.of(
                "ingestionSource", config.getIngestion().getSource().name().toLowerCase(),
                "lookbackDays", config.getAws().getLookbackDays(),
                "scheduleEnabled", config.getSchedule().isEnabled(),
                "scheduleCron", config.getSchedule().getCron(),
                "teamsConfigured", teamsConfig.isConfigured()
        ));
    }
}
