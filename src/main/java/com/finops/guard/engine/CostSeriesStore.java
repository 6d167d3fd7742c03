package com.finops.guard.engine;

import com.finops.guard.model.RawCostRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw cost rows of one pipeline run, in ingestion order.
 * Owned by a single run; not shared between runs.
 */
public class CostSeriesStore {

    private final List<RawCostRow> rows = new ArrayList<>();

    public void addAll(List<RawCostRow> batch) {
        rows.addAll(batch);
    }

    /**
     * Read-only view of the buffered rows. The row objects themselves are shared,
     * so normalizing them in place is visible through the store.
     */
    public List<RawCostRow> rows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Row count per dimension, in first-seen order.
     */
    public Map<String, Integer> countByDimension() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RawCostRow row : rows) {
            counts.merge(row.getDimension(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
