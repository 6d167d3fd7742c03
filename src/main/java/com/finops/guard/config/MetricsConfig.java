package com.finops.guard.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastAnomalyCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastAnomalyCount = registry.gauge("finops.anomalies.last_run", new AtomicInteger(0));
    }

    public void recordRun(String outcome) {
        Counter.builder("finops.pipeline.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordIngestedRows(String source, int rows) {
        DistributionSummary.builder("finops.ingestion.rows")
                .tag("source", source)
                .register(registry)
                .record(rows);
    }

    public void recordAnomaly(String severity) {
        Counter.builder("finops.anomaly.detected.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordEstimatedSavings(double savingsUsd) {
        DistributionSummary.builder("finops.report.estimated_savings_usd")
                .register(registry)
                .record(savingsUsd);
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateLastAnomalyCount(int count) {
        lastAnomalyCount.set(count);
    }
}
