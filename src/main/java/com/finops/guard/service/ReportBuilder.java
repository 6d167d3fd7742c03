package com.finops.guard.service;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Recommendation;
import com.finops.guard.model.ReportPayload;
import com.finops.guard.model.Severity;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the weekly report from ranked anomalies and their index-aligned recommendations.
 */
@Service
public class ReportBuilder {

    static final String TITLE = "FinOps Guard Weekly Report";
    static final String SUMMARY = "Weekly cloud cost review with anomalies and prioritized recommendations.";

    private final Clock clock;

    public ReportBuilder(Clock clock) {
        this.clock = clock;
    }

    public ReportPayload build(List<Anomaly> anomalies, List<Recommendation> recommendations) {
        double savings = 0.0;
        for (Recommendation r : recommendations) {
            savings += r.getEstimatedMonthlySavingsUsd();
        }

        double totalDelta = 0.0;
        long highCount = 0;
        for (Anomaly a : anomalies) {
            totalDelta += a.getDeltaAbs();
            if (a.getSeverity() == Severity.HIGH) highCount++;
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(ReportPayload.METRIC_ANOMALY_COUNT, (double) anomalies.size());
        metrics.put(ReportPayload.METRIC_ESTIMATED_SAVINGS, round2(savings));
        metrics.put(ReportPayload.METRIC_HIGH_SEVERITY_COUNT, (double) highCount);
        metrics.put(ReportPayload.METRIC_TOTAL_DELTA, round2(totalDelta));

        return ReportPayload.builder()
                .title(TITLE)
                .summary(SUMMARY)
                .metrics(metrics)
                .anomalies(List.copyOf(anomalies))
                .recommendations(List.copyOf(recommendations))
                .generatedAt(clock.millis())
                .build();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
