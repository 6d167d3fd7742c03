package com.finops.guard.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Detector settings for one run. Validated by the caller.
 */
@Value
@Builder
public class AnomalyThresholds {

    /** Minimum raw cost delta over the baseline mean, USD. */
    double minAbsoluteDeltaUsd;

    /** Minimum z-score of the evaluated day. */
    double anomalyZscore;

    /** Minimum baseline observations before a dimension is eligible. */
    int minHistoryPoints;

    /** Width of the trailing baseline, evaluated day excluded. */
    int baselineDays;
}
