package com.finops.guard.ingestion;

import com.finops.guard.config.FinOpsGuardConfig;
import com.finops.guard.config.FinOpsGuardConfig.IngestionSource;
import com.finops.guard.config.MetricsConfig;
import com.finops.guard.model.RawCostRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the configured ingestion provider and fetches the lookback window.
 * An unavailable or failing source degrades to an empty dataset.
 */
@Service
public class CostIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CostIngestionService.class);

    private final Map<IngestionSource, CostIngestionProvider> providers;
    private final FinOpsGuardConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public CostIngestionService(List<CostIngestionProvider> providers,
                                FinOpsGuardConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.providers = new EnumMap<>(IngestionSource.class);
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (CostIngestionProvider provider : providers) {
            this.providers.put(provider.getSource(), provider);
            log.info("Registered cost ingestion provider: {} -> {}",
                    provider.getSource(), provider.getClass().getSimpleName());
        }
    }

    public List<RawCostRow> ingest() {
        IngestionSource source = config.getIngestion().getSource();
        CostIngestionProvider provider = providers.get(source);
        if (provider == null) {
            log.warn("No cost ingestion provider available for source={}; continuing with empty dataset", source);
            metricsConfig.recordIngestedRows(source.name(), 0);
            return Collections.emptyList();
        }

        LocalDate end = LocalDate.now(clock);
        LocalDate start = end.minusDays(config.getAws().getLookbackDays());

        try {
            List<RawCostRow> rows = provider.fetchDailyCosts(start, end);
            List<RawCostRow> result = rows != null ? rows : Collections.emptyList();
            metricsConfig.recordIngestedRows(source.name(), result.size());
            return result;
        } catch (Exception e) {
            log.error("Cost ingestion from {} failed, continuing with empty dataset: {}",
                    source, e.getMessage(), e);
            metricsConfig.recordIngestedRows(source.name(), 0);
            return Collections.emptyList();
        }
    }
}
