package com.finops.guard.engine;

import com.finops.guard.model.CostPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Daily costs of a single dimension, kept in ascending day order.
 * Observations sharing a day stay in insertion order.
 */
class TimeSeries {

    private final String dimension;
    private final List<CostPoint> points = new ArrayList<>();
    private boolean sorted = true;

    TimeSeries(String dimension) {
        this.dimension = dimension;
    }

    void add(CostPoint point) {
        if (!points.isEmpty() && point.getDay().isBefore(points.get(points.size() - 1).getDay())) {
            sorted = false;
        }
        points.add(point);
    }

    String getDimension() {
        return dimension;
    }

    int size() {
        return points.size();
    }

    /**
     * The last {@code width} observations (or all of them when the series is shorter).
     */
    List<CostPoint> trailingWindow(int width) {
        ensureSorted();
        int from = Math.max(0, points.size() - width);
        return points.subList(from, points.size());
    }

    private void ensureSorted() {
        if (!sorted) {
            // List.sort is stable, so same-day ties keep their input order
            points.sort(Comparator.comparing(CostPoint::getDay));
            sorted = true;
        }
    }
}
