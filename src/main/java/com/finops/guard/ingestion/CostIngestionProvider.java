package com.finops.guard.ingestion;

import com.finops.guard.config.FinOpsGuardConfig.IngestionSource;
import com.finops.guard.model.RawCostRow;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of daily cost rows grouped by account and service.
 */
public interface CostIngestionProvider {

    IngestionSource getSource();

    /**
     * Fetch daily costs for {@code [start, end)}.
     *
     * @param start first day, inclusive
     * @param end   last day, exclusive
     * @return rows in source order; may be empty
     */
    List<RawCostRow> fetchDailyCosts(LocalDate start, LocalDate end);
}
