package com.finops.guard.ingestion;

import com.finops.guard.config.FinOpsGuardConfig.IngestionSource;
import com.finops.guard.model.RawCostRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic synthetic cost series for local runs and demos.
 *
 * Generates three dimensions with +/-2% daily noise:
 *   - prod:AmazonEC2      ~4000 USD/day, +15% spike on the last day
 *   - prod:AmazonS3       ~900 USD/day, steady
 *   - staging:AWSLambda   ~40 USD/day, steady
 */
@Component
public class SampleCostIngestionProvider implements CostIngestionProvider {

    private static final Logger log = LoggerFactory.getLogger(SampleCostIngestionProvider.class);

    private static final double NOISE_PCT = 0.02;
    private static final double SPIKE_PCT = 0.15;

    private static final List<SampleSeries> SERIES = List.of(
            new SampleSeries("prod", "AmazonEC2", "platform", 4000.0, true),
            new SampleSeries("prod", "AmazonS3", "platform", 900.0, false),
            new SampleSeries("staging", "AWSLambda", "data", 40.0, false)
    );

    @Override
    public IngestionSource getSource() {
        return IngestionSource.SAMPLE;
    }

    @Override
    public List<RawCostRow> fetchDailyCosts(LocalDate start, LocalDate end) {
        Random random = new Random(42); // fixed seed for reproducibility
        List<RawCostRow> rows = new ArrayList<>();
        LocalDate lastDay = end.minusDays(1);

        for (SampleSeries s : SERIES) {
            for (LocalDate day = start; day.isBefore(end); day = day.plusDays(1)) {
                double noise = 1.0 + (random.nextDouble() * 2 - 1) * NOISE_PCT;
                double cost = s.baseCostUsd() * noise;
                if (s.spikeOnLastDay() && day.equals(lastDay)) {
                    cost = s.baseCostUsd() * (1.0 + SPIKE_PCT);
                }
                rows.add(RawCostRow.builder()
                        .day(day.toString())
                        .account(s.account())
                        .service(s.service())
                        .tag(s.tag())
                        .costUsd(Math.round(cost * 100.0) / 100.0)
                        .build());
            }
        }

        log.info("Generated {} sample cost rows for {} dimensions ({} to {})",
                rows.size(), SERIES.size(), start, lastDay);
        return rows;
    }

    private record SampleSeries(String account, String service, String tag,
                                double baseCostUsd, boolean spikeOnLastDay) {}
}
