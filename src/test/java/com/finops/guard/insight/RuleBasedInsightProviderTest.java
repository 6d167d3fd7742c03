package com.finops.guard.insight;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Insight;
import com.finops.guard.model.Severity;
import com.finops.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedInsightProviderTest {

    private final RuleBasedInsightProvider provider = new RuleBasedInsightProvider(new RemediationCatalog());

    @Test
    void produceInsight_ec2Anomaly_usesComputeHypothesis() {
        Anomaly anomaly = TestDataFactory.createAnomaly("prod:AmazonEC2", 20.0, 10.0, Severity.HIGH);

        Insight insight = provider.produceInsight(anomaly);

        assertThat(insight.getAnomaly()).isSameAs(anomaly);
        assertThat(insight.getHypothesis()).contains("EC2");
        assertThat(insight.getConfidence()).isEqualTo(0.85);
    }

    @Test
    void produceInsight_mediumSeverity_lowerConfidence() {
        Anomaly anomaly = TestDataFactory.createAnomaly("prod:AmazonS3", 8.0, 2.6, Severity.MEDIUM);

        Insight insight = provider.produceInsight(anomaly);

        assertThat(insight.getHypothesis()).contains("lifecycle");
        assertThat(insight.getConfidence()).isEqualTo(0.63);
    }

    @Test
    void produceInsight_confidenceCapped() {
        Anomaly anomaly = TestDataFactory.createAnomaly("prod:AmazonEC2", 500.0, 80.0, Severity.HIGH);

        assertThat(provider.produceInsight(anomaly).getConfidence()).isEqualTo(0.95);
    }

    @Test
    void produceInsight_unknownService_usesFallback() {
        Anomaly anomaly = TestDataFactory.createAnomaly("unknown:unknown", 20.0, 10.0, Severity.HIGH);

        Insight insight = provider.produceInsight(anomaly);

        assertThat(insight.getHypothesis()).startsWith("Cost rose sharply");
        assertThat(insight.getConfidence()).isBetween(0.0, 1.0);
    }
}
