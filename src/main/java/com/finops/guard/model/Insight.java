package com.finops.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Hypothesis explaining an anomaly")
public class Insight {

    Anomaly anomaly;

    @Schema(description = "Natural-language explanation",
            example = "Sustained EC2 growth likely due to oversized instances in a non-optimized autoscaling group.")
    String hypothesis;

    @Schema(description = "Confidence in [0, 1]", example = "0.78")
    double confidence;
}
