package com.finops.guard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@Schema(description = "A statistically significant daily cost spike for one account:service dimension")
public class Anomaly {

    @Schema(description = "Evaluated day (last observation of the dimension)", example = "2026-01-11")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate day;

    @Schema(description = "account:service key", example = "prod:AmazonEC2")
    String dimension;

    @Schema(description = "Evaluated cost minus baseline mean, USD", example = "20.0")
    double deltaAbs;

    @Schema(description = "Delta relative to the baseline mean, percent (100 when the baseline mean is 0)", example = "200.0")
    double deltaPct;

    @Schema(description = "Z-score against the baseline; 10.0 when the baseline has zero variance", example = "10.0")
    double score;

    @Schema(description = "medium or high", example = "high")
    Severity severity;
}
