package com.finops.guard.insight;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Dimension;
import com.finops.guard.model.Insight;
import com.finops.guard.model.Recommendation;
import org.springframework.stereotype.Component;

/**
 * Maps an anomaly to the catalog action of its service.
 * Savings = daily excess x 30 days x the action's recoverable fraction.
 */
@Component
public class RuleBasedRecommendationEngine implements RecommendationEngine {

    static final int DAYS_PER_MONTH = 30;

    private final RemediationCatalog catalog;

    public RuleBasedRecommendationEngine(RemediationCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Recommendation produceRecommendation(Anomaly anomaly, Insight insight) {
        RemediationCatalog.Entry entry = catalog.lookup(Dimension.serviceOf(anomaly.getDimension()));
        double savings = anomaly.getDeltaAbs() * DAYS_PER_MONTH * entry.recoverableFraction();

        return Recommendation.builder()
                .action(entry.action())
                .target(anomaly.getDimension())
                .estimatedMonthlySavingsUsd(Math.round(savings * 100.0) / 100.0)
                .effort(entry.effort())
                .risk(entry.risk())
                .build();
    }
}
