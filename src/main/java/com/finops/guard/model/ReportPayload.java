package com.finops.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Weekly cost review report")
public class ReportPayload {

    public static final String METRIC_ANOMALY_COUNT = "anomaly_count";
    public static final String METRIC_ESTIMATED_SAVINGS = "estimated_monthly_savings_usd";
    public static final String METRIC_HIGH_SEVERITY_COUNT = "high_severity_count";
    public static final String METRIC_TOTAL_DELTA = "total_delta_usd";

    @Schema(example = "FinOps Guard Weekly Report")
    String title;

    @Schema(example = "Weekly cloud cost review with anomalies and prioritized recommendations.")
    String summary;

    @Schema(description = "Named numeric facts; always contains anomaly_count and estimated_monthly_savings_usd")
    Map<String, Double> metrics;

    @Schema(description = "Anomalies ranked by score, highest first")
    List<Anomaly> anomalies;

    @Schema(description = "Recommendations, index-aligned with anomalies")
    List<Recommendation> recommendations;

    @Schema(description = "Generation timestamp in epoch milliseconds", example = "1768118400000")
    long generatedAt;

    public double metric(String name) {
        return metrics.getOrDefault(name, 0.0);
    }
}
