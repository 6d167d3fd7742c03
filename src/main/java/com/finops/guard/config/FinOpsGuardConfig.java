package com.finops.guard.config;

import com.finops.guard.engine.AnomalyThresholds;
import com.finops.guard.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "finops")
public class FinOpsGuardConfig {

    private Thresholds thresholds = new Thresholds();

    private Aws aws = new Aws();

    private Ingestion ingestion = new Ingestion();

    private Schedule schedule = new Schedule();

    @PostConstruct
    public void validate() {
        if (thresholds.getMinAbsoluteDeltaUsd() < 0) {
            throw new ConfigurationException("finops.thresholds.min-absolute-delta-usd", "must be >= 0");
        }
        if (thresholds.getAnomalyZscore() <= 0) {
            throw new ConfigurationException("finops.thresholds.anomaly-zscore", "must be > 0");
        }
        if (thresholds.getMinHistoryPoints() < 1) {
            throw new ConfigurationException("finops.thresholds.min-history-points", "must be >= 1");
        }
        if (thresholds.getBaselineDays() < 1) {
            throw new ConfigurationException("finops.thresholds.baseline-days", "must be >= 1");
        }
        if (aws.getLookbackDays() < 1) {
            throw new ConfigurationException("finops.aws.lookback-days", "must be >= 1");
        }
        if (ingestion.getSource() == null) {
            throw new ConfigurationException("finops.ingestion.source", "must be one of sample, aws, none");
        }
    }

    public AnomalyThresholds toAnomalyThresholds() {
        return AnomalyThresholds.builder()
                .minAbsoluteDeltaUsd(thresholds.getMinAbsoluteDeltaUsd())
                .anomalyZscore(thresholds.getAnomalyZscore())
                .minHistoryPoints(thresholds.getMinHistoryPoints())
                .baselineDays(thresholds.getBaselineDays())
                .build();
    }

    @Data
    public static class Thresholds {
        // Spikes smaller than this (in USD over the baseline mean) are never reported.
        private double minAbsoluteDeltaUsd = 5.0;

        // Minimum z-score of the evaluated day against its baseline.
        private double anomalyZscore = 2.5;

        // Baseline observations a dimension needs before it is evaluated at all.
        private int minHistoryPoints = 7;

        // Trailing window width, evaluated day excluded.
        private int baselineDays = 14;
    }

    @Data
    public static class Aws {
        private int lookbackDays = 90;
        private String region = "us-east-1";
    }

    @Data
    public static class Ingestion {
        private IngestionSource source = IngestionSource.SAMPLE;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 8 * * MON";
    }

    public enum IngestionSource {
        SAMPLE,
        AWS,
        NONE
    }
}
