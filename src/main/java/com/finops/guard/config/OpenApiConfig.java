package com.finops.guard.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI finOpsGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FinOps Guard API")
                        .version("1.0.0")
                        .description(
                                "Weekly cloud cost review: flags daily cost spikes per account and service.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Ingest daily cost rows (sample data or AWS Cost Explorer)\n" +
                                "2. Fill missing row fields with defaults\n" +
                                "3. Score the latest day of every `account:service` dimension against its trailing baseline\n" +
                                "4. Attach a hypothesis and a remediation to every anomaly\n" +
                                "5. Build the report and post it to the Teams webhook\n\n" +
                                "**Severity:** `high` when score >= z-score threshold + 1, otherwise `medium`.")
                        .contact(new Contact().name("FinOps Guard Team")));
    }
}
