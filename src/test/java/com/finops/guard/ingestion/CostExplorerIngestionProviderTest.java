package com.finops.guard.ingestion;

import com.finops.guard.model.RawCostRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.DateInterval;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageRequest;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageResponse;
import software.amazon.awssdk.services.costexplorer.model.Granularity;
import software.amazon.awssdk.services.costexplorer.model.Group;
import software.amazon.awssdk.services.costexplorer.model.MetricValue;
import software.amazon.awssdk.services.costexplorer.model.ResultByTime;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CostExplorerIngestionProviderTest {

    @Mock private CostExplorerClient costExplorer;

    private static Group group(String account, String service, String amount) {
        return Group.builder()
                .keys(account, service)
                .metrics(Map.of("UnblendedCost", MetricValue.builder().amount(amount).unit("USD").build()))
                .build();
    }

    private static ResultByTime day(String start, String end, Group... groups) {
        return ResultByTime.builder()
                .timePeriod(DateInterval.builder().start(start).end(end).build())
                .groups(groups)
                .build();
    }

    @Test
    void fetchDailyCosts_followsPaginationAndMapsGroups() {
        GetCostAndUsageResponse page1 = GetCostAndUsageResponse.builder()
                .resultsByTime(day("2026-01-01", "2026-01-02",
                        group("111111111111", "Amazon Elastic Compute Cloud - Compute", "120.50"),
                        group("111111111111", "Amazon Simple Storage Service", "30")))
                .nextPageToken("page-2")
                .build();
        GetCostAndUsageResponse page2 = GetCostAndUsageResponse.builder()
                .resultsByTime(day("2026-01-02", "2026-01-03",
                        group("222222222222", "AWS Lambda", "-0.01")))
                .build();
        when(costExplorer.getCostAndUsage(any(GetCostAndUsageRequest.class))).thenReturn(page1, page2);

        CostExplorerIngestionProvider provider = new CostExplorerIngestionProvider(costExplorer);
        List<RawCostRow> rows = provider.fetchDailyCosts(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 3));

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).getDay()).isEqualTo("2026-01-01");
        assertThat(rows.get(0).getAccount()).isEqualTo("111111111111");
        assertThat(rows.get(0).getService()).isEqualTo("Amazon Elastic Compute Cloud - Compute");
        assertThat(rows.get(0).getCostUsd()).isEqualTo(120.50);
        assertThat(rows.get(0).getTag()).isNull();
        // credits and refunds never produce negative cost
        assertThat(rows.get(2).getCostUsd()).isEqualTo(0.0);

        ArgumentCaptor<GetCostAndUsageRequest> captor = ArgumentCaptor.forClass(GetCostAndUsageRequest.class);
        verify(costExplorer, times(2)).getCostAndUsage(captor.capture());
        GetCostAndUsageRequest first = captor.getAllValues().get(0);
        assertThat(first.granularity()).isEqualTo(Granularity.DAILY);
        assertThat(first.metrics()).containsExactly("UnblendedCost");
        assertThat(first.timePeriod().start()).isEqualTo("2026-01-01");
        assertThat(first.timePeriod().end()).isEqualTo("2026-01-03");
        assertThat(first.groupBy()).extracting(g -> g.key()).containsExactly("LINKED_ACCOUNT", "SERVICE");
        assertThat(first.nextPageToken()).isNull();
        assertThat(captor.getAllValues().get(1).nextPageToken()).isEqualTo("page-2");
    }

    @Test
    void fetchDailyCosts_noResults_returnsEmpty() {
        when(costExplorer.getCostAndUsage(any(GetCostAndUsageRequest.class)))
                .thenReturn(GetCostAndUsageResponse.builder().build());

        CostExplorerIngestionProvider provider = new CostExplorerIngestionProvider(costExplorer);

        assertThat(provider.fetchDailyCosts(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 3))).isEmpty();
    }
}
