package com.finops.guard.insight;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Dimension;
import com.finops.guard.model.Insight;
import com.finops.guard.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Picks a hypothesis from the {@link RemediationCatalog} by service name.
 * Confidence starts at 0.6 for medium and 0.75 for high severity and grows
 * with the score, capped at 0.95.
 */
@Component
public class RuleBasedInsightProvider implements InsightProvider {

    private static final double MEDIUM_BASE_CONFIDENCE = 0.6;
    private static final double HIGH_BASE_CONFIDENCE = 0.75;
    private static final double MAX_CONFIDENCE = 0.95;

    private final RemediationCatalog catalog;

    public RuleBasedInsightProvider(RemediationCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Insight produceInsight(Anomaly anomaly) {
        RemediationCatalog.Entry entry = catalog.lookup(Dimension.serviceOf(anomaly.getDimension()));

        double base = anomaly.getSeverity() == Severity.HIGH ? HIGH_BASE_CONFIDENCE : MEDIUM_BASE_CONFIDENCE;
        double confidence = Math.min(MAX_CONFIDENCE, base + anomaly.getScore() * 0.01);

        return Insight.builder()
                .anomaly(anomaly)
                .hypothesis(entry.hypothesis())
                .confidence(Math.round(confidence * 100.0) / 100.0)
                .build();
    }
}
