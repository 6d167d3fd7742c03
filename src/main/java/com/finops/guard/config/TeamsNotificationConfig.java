package com.finops.guard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "finops.notification.teams")
public class TeamsNotificationConfig {

    // Incoming webhook of the target channel. Blank disables delivery.
    private String webhookUrl;

    private int timeoutSeconds = 10;

    public boolean isConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
