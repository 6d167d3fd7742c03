package com.finops.guard.engine;

import com.finops.guard.exception.DataParseException;
import com.finops.guard.model.Anomaly;
import com.finops.guard.model.CostPoint;
import com.finops.guard.model.RawCostRow;
import com.finops.guard.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flags upward daily cost spikes per account:service dimension.
 *
 * Each dimension is evaluated once, on its latest observation. The preceding
 * {@code baselineDays} observations form the baseline; the latest day is
 * reported when it clears both the absolute delta and the z-score thresholds.
 * A perfectly flat baseline gives the sentinel score {@value #ZERO_VARIANCE_SCORE}
 * and bypasses the z-score threshold.
 *
 * Stateless: safe to call concurrently with different thresholds.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    static final double ZERO_VARIANCE_SCORE = 10.0;
    static final double ZERO_BASELINE_DELTA_PCT = 100.0;

    /**
     * Detect anomalies in normalized cost rows.
     *
     * @param rows       normalized rows (day, account, service present)
     * @param thresholds detection settings
     * @return anomalies ranked by score, highest first
     * @throws DataParseException if a row's day is not an ISO-8601 date
     */
    public List<Anomaly> detect(List<RawCostRow> rows, AnomalyThresholds thresholds) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(thresholds, "thresholds");

        Map<String, TimeSeries> seriesByDimension = group(rows);
        List<Anomaly> anomalies = new ArrayList<>();

        for (TimeSeries series : seriesByDimension.values()) {
            Anomaly anomaly = evaluate(series, thresholds);
            if (anomaly != null) {
                anomalies.add(anomaly);
            }
        }

        // Stable sort: equal scores keep dimension first-seen order
        anomalies.sort(Comparator.comparingDouble(Anomaly::getScore).reversed());

        log.info("Anomaly detection complete: rows={}, dimensions={}, anomalies={}",
                rows.size(), seriesByDimension.size(), anomalies.size());
        return anomalies;
    }

    private Map<String, TimeSeries> group(List<RawCostRow> rows) {
        Map<String, TimeSeries> seriesByDimension = new LinkedHashMap<>();
        for (RawCostRow row : rows) {
            String dimension = row.getDimension();
            CostPoint point = toPoint(row, dimension);
            seriesByDimension.computeIfAbsent(dimension, TimeSeries::new).add(point);
        }
        return seriesByDimension;
    }

    private CostPoint toPoint(RawCostRow row, String dimension) {
        LocalDate day;
        try {
            day = LocalDate.parse(row.getDay());
        } catch (DateTimeParseException | NullPointerException e) {
            throw new DataParseException(dimension, row.getDay(), e);
        }
        if (row.getCostUsd() == null) {
            throw new IllegalArgumentException("Missing cost_usd for dimension " + dimension + " on " + day);
        }
        return CostPoint.builder()
                .day(day)
                .account(row.getAccount())
                .service(row.getService())
                .tag(row.getTag())
                .costUsd(row.getCostUsd())
                .build();
    }

    private Anomaly evaluate(TimeSeries series, AnomalyThresholds thresholds) {
        String dimension = series.getDimension();

        if (series.size() < thresholds.getMinHistoryPoints() + 1) {
            log.debug("Skipping {}: {} observations, need more than {}",
                    dimension, series.size(), thresholds.getMinHistoryPoints());
            return null;
        }

        List<CostPoint> window = series.trailingWindow(thresholds.getBaselineDays() + 1);
        CostPoint evaluated = window.get(window.size() - 1);
        List<CostPoint> baseline = window.subList(0, window.size() - 1);

        if (baseline.size() < thresholds.getMinHistoryPoints()) {
            log.debug("Skipping {}: baseline window holds {} points, need {}",
                    dimension, baseline.size(), thresholds.getMinHistoryPoints());
            return null;
        }

        // A flat baseline is detected on the raw costs: a summed mean can drift by an ulp
        // and leave a near-zero std-dev instead of exactly zero.
        boolean flat = isFlat(baseline);
        double baseMean = flat ? baseline.get(0).getCostUsd() : mean(baseline);
        double baseStd = flat ? 0.0 : populationStdDev(baseline, baseMean);
        double deltaAbs = evaluated.getCostUsd() - baseMean;

        // Gate on the reported (rounded) delta
        if (round2(deltaAbs) < thresholds.getMinAbsoluteDeltaUsd()) {
            return null;
        }

        double score;
        if (flat) {
            // Any rise over a flat baseline is flagged, whatever the z-score threshold
            if (deltaAbs <= 0.0) {
                return null;
            }
            score = ZERO_VARIANCE_SCORE;
        } else {
            score = deltaAbs / baseStd;
            if (score < thresholds.getAnomalyZscore()) {
                log.debug("Skipping {}: delta={} but score={} below {}",
                        dimension, round2(deltaAbs), round2(score), thresholds.getAnomalyZscore());
                return null;
            }
        }

        double deltaPct = baseMean > 0 ? deltaAbs / baseMean * 100.0 : ZERO_BASELINE_DELTA_PCT;
        Severity severity = Severity.classify(score, thresholds.getAnomalyZscore());

        log.debug("Anomaly on {} at {}: cost={}, baselineMean={}, baselineStd={}, score={}, severity={}",
                dimension, evaluated.getDay(), evaluated.getCostUsd(),
                round2(baseMean), round2(baseStd), round2(score), severity);

        return Anomaly.builder()
                .day(evaluated.getDay())
                .dimension(dimension)
                .deltaAbs(round2(deltaAbs))
                .deltaPct(round2(deltaPct))
                .score(round2(score))
                .severity(severity)
                .build();
    }

    static boolean isFlat(List<CostPoint> points) {
        double first = points.get(0).getCostUsd();
        for (CostPoint p : points) {
            if (Double.compare(p.getCostUsd(), first) != 0) {
                return false;
            }
        }
        return true;
    }

    static double mean(List<CostPoint> points) {
        double sum = 0.0;
        for (CostPoint p : points) {
            sum += p.getCostUsd();
        }
        return sum / points.size();
    }

    // n divisor, not n-1
    static double populationStdDev(List<CostPoint> points, double mean) {
        double sumSq = 0.0;
        for (CostPoint p : points) {
            double d = p.getCostUsd() - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / points.size());
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
