package com.finops.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A daily cost row as returned by ingestion. Every field except {@code costUsd}
 * may be absent until the row has been normalized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Raw daily cost row from the ingestion source")
public class RawCostRow {

    @Schema(description = "ISO-8601 calendar day", example = "2026-01-11")
    private String day;

    @Schema(description = "Cloud account (linked account id or alias)", example = "prod")
    private String account;

    @Schema(description = "Cloud service name", example = "AmazonEC2")
    private String service;

    @Schema(description = "Cost allocation tag", example = "platform")
    private String tag;

    @Schema(description = "Unblended cost in USD", example = "4100.0")
    private Double costUsd;

    public String getDimension() {
        return Dimension.key(account, service);
    }
}
