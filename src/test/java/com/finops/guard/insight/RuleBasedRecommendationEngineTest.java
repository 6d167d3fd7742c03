package com.finops.guard.insight;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.ImpactLevel;
import com.finops.guard.model.Recommendation;
import com.finops.guard.model.Severity;
import com.finops.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedRecommendationEngineTest {

    private final RuleBasedRecommendationEngine engine = new RuleBasedRecommendationEngine(new RemediationCatalog());

    @Test
    void produceRecommendation_targetsAnomalyDimension() {
        Anomaly anomaly = TestDataFactory.createAnomaly("prod:AmazonEC2", 20.0, 10.0, Severity.HIGH);

        Recommendation rec = engine.produceRecommendation(anomaly, TestDataFactory.createInsight(anomaly));

        assertThat(rec.getTarget()).isEqualTo("prod:AmazonEC2");
        assertThat(rec.getAction()).isEqualTo("Rightsize EC2 instances and enforce scale-in policy");
        assertThat(rec.getEffort()).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(rec.getRisk()).isEqualTo(ImpactLevel.LOW);
    }

    @Test
    void produceRecommendation_savingsFromDailyExcess() {
        // 20 USD/day x 30 days x 0.35 recoverable
        Anomaly anomaly = TestDataFactory.createAnomaly("prod:AmazonEC2", 20.0, 10.0, Severity.HIGH);

        Recommendation rec = engine.produceRecommendation(anomaly, TestDataFactory.createInsight(anomaly));

        assertThat(rec.getEstimatedMonthlySavingsUsd()).isEqualTo(210.0);
    }

    @Test
    void produceRecommendation_serviceMatchIsCaseInsensitive() {
        Anomaly anomaly = TestDataFactory.createAnomaly("data:AWS Lambda", 10.0, 4.0, Severity.MEDIUM);

        Recommendation rec = engine.produceRecommendation(anomaly, TestDataFactory.createInsight(anomaly));

        assertThat(rec.getAction()).contains("Lambda");
        assertThat(rec.getEstimatedMonthlySavingsUsd()).isEqualTo(90.0);
    }

    @Test
    void produceRecommendation_unknownService_fallbackAction() {
        Anomaly anomaly = TestDataFactory.createAnomaly("prod:Amazon Kendra", 100.0, 6.0, Severity.HIGH);

        Recommendation rec = engine.produceRecommendation(anomaly, TestDataFactory.createInsight(anomaly));

        assertThat(rec.getAction()).startsWith("Review recent usage changes");
        assertThat(rec.getEstimatedMonthlySavingsUsd()).isEqualTo(300.0);
    }
}
