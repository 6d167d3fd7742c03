package com.finops.guard.ingestion;

import com.finops.guard.config.FinOpsGuardConfig.IngestionSource;
import com.finops.guard.model.RawCostRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.DateInterval;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageRequest;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageResponse;
import software.amazon.awssdk.services.costexplorer.model.Granularity;
import software.amazon.awssdk.services.costexplorer.model.Group;
import software.amazon.awssdk.services.costexplorer.model.GroupDefinition;
import software.amazon.awssdk.services.costexplorer.model.GroupDefinitionType;
import software.amazon.awssdk.services.costexplorer.model.MetricValue;
import software.amazon.awssdk.services.costexplorer.model.ResultByTime;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily unblended cost per linked account and service from AWS Cost Explorer.
 * Active only when finops.ingestion.source=aws.
 */
@Component
@ConditionalOnProperty(name = "finops.ingestion.source", havingValue = "aws")
public class CostExplorerIngestionProvider implements CostIngestionProvider {

    private static final Logger log = LoggerFactory.getLogger(CostExplorerIngestionProvider.class);

    static final String METRIC = "UnblendedCost";

    private final CostExplorerClient costExplorer;

    public CostExplorerIngestionProvider(CostExplorerClient costExplorer) {
        this.costExplorer = costExplorer;
    }

    @Override
    public IngestionSource getSource() {
        return IngestionSource.AWS;
    }

    @Override
    public List<RawCostRow> fetchDailyCosts(LocalDate start, LocalDate end) {
        log.info("Fetching daily cost by account and service from Cost Explorer ({} to {})", start, end);
        List<RawCostRow> rows = new ArrayList<>();
        String nextPageToken = null;
        int pages = 0;

        do {
            GetCostAndUsageRequest request = GetCostAndUsageRequest.builder()
                    .timePeriod(DateInterval.builder().start(start.toString()).end(end.toString()).build())
                    .granularity(Granularity.DAILY)
                    .metrics(METRIC)
                    .groupBy(
                            GroupDefinition.builder().type(GroupDefinitionType.DIMENSION).key("LINKED_ACCOUNT").build(),
                            GroupDefinition.builder().type(GroupDefinitionType.DIMENSION).key("SERVICE").build())
                    .nextPageToken(nextPageToken)
                    .build();

            GetCostAndUsageResponse response = costExplorer.getCostAndUsage(request);
            for (ResultByTime result : response.resultsByTime()) {
                String day = result.timePeriod().start();
                for (Group group : result.groups()) {
                    rows.add(toRow(day, group));
                }
            }
            nextPageToken = response.nextPageToken();
            pages++;
        } while (nextPageToken != null && !nextPageToken.isEmpty());

        log.info("Cost Explorer returned {} rows in {} page(s)", rows.size(), pages);
        return rows;
    }

    private RawCostRow toRow(String day, Group group) {
        List<String> keys = group.keys();
        MetricValue metric = group.metrics().get(METRIC);
        double cost = metric != null && metric.amount() != null ? Double.parseDouble(metric.amount()) : 0.0;

        return RawCostRow.builder()
                .day(day)
                .account(keys.size() > 0 ? keys.get(0) : null)
                .service(keys.size() > 1 ? keys.get(1) : null)
                .costUsd(Math.max(0.0, cost))
                .build();
    }
}
