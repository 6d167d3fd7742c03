package com.finops.guard.insight;

import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Insight;

/**
 * Explains an anomaly with a hypothesis and a confidence score.
 */
public interface InsightProvider {

    /**
     * @param anomaly a detected anomaly
     * @return hypothesis with confidence in [0, 1]; never null
     */
    Insight produceInsight(Anomaly anomaly);
}
