package com.finops.guard.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;

@Configuration
@ConditionalOnProperty(name = "finops.ingestion.source", havingValue = "aws")
public class AwsConfig {

    // Credentials come from the SDK default provider chain.
    @Bean(destroyMethod = "close")
    public CostExplorerClient costExplorerClient(FinOpsGuardConfig config) {
        return CostExplorerClient.builder()
                .region(Region.of(config.getAws().getRegion()))
                .build();
    }
}
