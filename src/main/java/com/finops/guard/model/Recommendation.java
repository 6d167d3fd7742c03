package com.finops.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Remediation action for one anomaly")
public class Recommendation {

    @Schema(description = "Action to take", example = "Rightsize EC2 instances and enforce scale-in policy")
    String action;

    @Schema(description = "Dimension of the anomaly this action addresses", example = "prod:AmazonEC2")
    String target;

    @Schema(description = "Estimated monthly savings in USD", example = "620.0")
    double estimatedMonthlySavingsUsd;

    @Schema(description = "Implementation effort", example = "medium")
    ImpactLevel effort;

    @Schema(description = "Operational risk", example = "low")
    ImpactLevel risk;
}
