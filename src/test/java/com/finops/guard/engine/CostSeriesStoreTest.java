package com.finops.guard.engine;

import com.finops.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import com.finops.guard.model.RawCostRow;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CostSeriesStoreTest {

    @Test
    void countByDimension_groupsInFirstSeenOrder() {
        CostSeriesStore store = new CostSeriesStore();
        store.addAll(TestDataFactory.createSeries("prod", "AmazonS3", 1.0, 2.0));
        store.addAll(TestDataFactory.createSeries("prod", "AmazonEC2", 3.0));
        store.addAll(TestDataFactory.createSeries("prod", "AmazonS3", 4.0));

        Map<String, Integer> counts = store.countByDimension();

        assertThat(store.size()).isEqualTo(4);
        assertThat(counts.keySet()).containsExactly("prod:AmazonS3", "prod:AmazonEC2");
        assertThat(counts).containsEntry("prod:AmazonS3", 3).containsEntry("prod:AmazonEC2", 1);
    }

    @Test
    void newStore_isEmpty() {
        CostSeriesStore store = new CostSeriesStore();

        assertThat(store.isEmpty()).isTrue();
        assertThat(store.countByDimension()).isEmpty();
    }

    @Test
    void rows_isReadOnlyView() {
        CostSeriesStore store = new CostSeriesStore();
        store.addAll(TestDataFactory.createSeries("prod", "AmazonS3", 1.0));

        List<RawCostRow> rows = store.rows();

        assertThatThrownBy(() -> rows.add(TestDataFactory.createRow("2026-01-02", "prod", "AmazonS3", 2.0)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void countByDimension_afterNormalization_usesDefaultKeys() {
        List<RawCostRow> rows = TestDataFactory.createSeries("prod", "AmazonS3", 1.0, 2.0);
        rows.forEach(r -> {
            r.setAccount(null);
            r.setService(" ");
        });
        CostSeriesStore store = new CostSeriesStore();
        store.addAll(rows);

        new CostNormalizer(Clock.fixed(Instant.parse("2026-01-12T00:00:00Z"), ZoneOffset.UTC))
                .normalize(store.rows());

        assertThat(store.countByDimension()).containsOnlyKeys("unknown:unknown");
    }
}
