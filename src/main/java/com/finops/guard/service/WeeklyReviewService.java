package com.finops.guard.service;

import com.finops.guard.config.FinOpsGuardConfig;
import com.finops.guard.config.MetricsConfig;
import com.finops.guard.engine.AnomalyDetector;
import com.finops.guard.engine.CostNormalizer;
import com.finops.guard.engine.CostSeriesStore;
import com.finops.guard.exception.DeliveryException;
import com.finops.guard.exception.ReportDeliveryException;
import com.finops.guard.ingestion.CostIngestionService;
import com.finops.guard.insight.InsightProvider;
import com.finops.guard.insight.RecommendationEngine;
import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Insight;
import com.finops.guard.model.RawCostRow;
import com.finops.guard.model.Recommendation;
import com.finops.guard.model.ReportPayload;
import com.finops.guard.notification.NotificationSink;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the weekly cost review end to end.
 *
 * Flow:
 * 1. Ingest daily cost rows (empty on source failure)
 * 2. Normalize missing row fields
 * 3. Detect anomalies per account:service dimension
 * 4. Produce one insight and one recommendation per anomaly
 * 5. Build the report and keep it as the latest report
 * 6. Deliver it to the notification sink, if one is configured
 *
 * Each stage finishes before the next starts. The report is only built once
 * anomalies and recommendations are both complete.
 */
@Service
public class WeeklyReviewService {

    private static final Logger log = LoggerFactory.getLogger(WeeklyReviewService.class);

    private final CostIngestionService ingestionService;
    private final CostNormalizer normalizer;
    private final AnomalyDetector detector;
    private final InsightProvider insightProvider;
    private final RecommendationEngine recommendationEngine;
    private final ReportBuilder reportBuilder;
    private final NotificationSink notificationSink;
    private final FinOpsGuardConfig config;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<ReportPayload> latestReport = new AtomicReference<>();

    public WeeklyReviewService(CostIngestionService ingestionService,
                               CostNormalizer normalizer,
                               AnomalyDetector detector,
                               InsightProvider insightProvider,
                               RecommendationEngine recommendationEngine,
                               ReportBuilder reportBuilder,
                               NotificationSink notificationSink,
                               FinOpsGuardConfig config,
                               MetricsConfig metricsConfig) {
        this.ingestionService = ingestionService;
        this.normalizer = normalizer;
        this.detector = detector;
        this.insightProvider = insightProvider;
        this.recommendationEngine = recommendationEngine;
        this.reportBuilder = reportBuilder;
        this.notificationSink = notificationSink;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Execute one full review and return the report.
     *
     * @throws com.finops.guard.exception.DataParseException if a cost row has an invalid day
     * @throws ReportDeliveryException if the report was built but could not be delivered
     */
    @Observed(name = "finops.weekly_review", contextualName = "run-weekly-review")
    public ReportPayload runWeekly() {
        log.info("=== Weekly cost review started ===");

        CostSeriesStore store = new CostSeriesStore();
        store.addAll(ingestionService.ingest());
        log.info("Ingested {} cost rows", store.size());

        ReportPayload report;
        try {
            report = review(store.rows());
        } catch (RuntimeException e) {
            metricsConfig.recordRun("failed");
            throw e;
        }

        latestReport.set(report);
        deliver(report);

        metricsConfig.recordRun("success");
        log.info("=== Weekly cost review finished: anomalies={}, estimatedMonthlySavings={} ===",
                (long) report.metric(ReportPayload.METRIC_ANOMALY_COUNT),
                report.metric(ReportPayload.METRIC_ESTIMATED_SAVINGS));
        return report;
    }

    /**
     * Normalize, detect, explain and recommend over the given rows. No I/O.
     */
    public ReportPayload review(List<RawCostRow> rows) {
        CostSeriesStore normalized = new CostSeriesStore();
        normalized.addAll(normalizer.normalize(rows));
        log.info("Reviewing {} cost rows across {} dimensions",
                normalized.size(), normalized.countByDimension().size());
        List<Anomaly> anomalies = detector.detect(normalized.rows(), config.toAnomalyThresholds());

        List<Insight> insights = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            insights.add(insightProvider.produceInsight(anomaly));
        }

        List<Recommendation> recommendations = new ArrayList<>(anomalies.size());
        for (int i = 0; i < anomalies.size(); i++) {
            Anomaly anomaly = anomalies.get(i);
            Recommendation rec = recommendationEngine.produceRecommendation(anomaly, insights.get(i));
            if (rec == null || !anomaly.getDimension().equals(rec.getTarget())) {
                throw new IllegalStateException("Recommendation target does not match anomaly dimension "
                        + anomaly.getDimension());
            }
            recommendations.add(rec);
            metricsConfig.recordAnomaly(anomaly.getSeverity().value());
        }

        ReportPayload report = reportBuilder.build(anomalies, recommendations);
        metricsConfig.updateLastAnomalyCount(anomalies.size());
        metricsConfig.recordEstimatedSavings(report.metric(ReportPayload.METRIC_ESTIMATED_SAVINGS));
        return report;
    }

    public Optional<ReportPayload> getLatestReport() {
        return Optional.ofNullable(latestReport.get());
    }

    private void deliver(ReportPayload report) {
        if (!notificationSink.isConfigured()) {
            log.info("Notification sink '{}' not configured; skipping delivery", notificationSink.channel());
            metricsConfig.recordNotification(notificationSink.channel(), "skipped");
            return;
        }

        try {
            notificationSink.deliver(report);
        } catch (DeliveryException e) {
            metricsConfig.recordRun("delivery_failed");
            log.error("Report delivery via {} failed: {}", notificationSink.channel(), e.getMessage(), e);
            throw new ReportDeliveryException(report, e);
        }
    }
}
