package com.finops.guard.insight;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Insight;
import com.finops.guard.model.Recommendation;

/**
 * Turns an anomaly (and its insight) into a remediation action.
 * Implementations must return exactly one recommendation whose target is the anomaly's dimension.
 */
public interface RecommendationEngine {

    Recommendation produceRecommendation(Anomaly anomaly, Insight insight);
}
