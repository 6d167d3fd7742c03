package com.finops.guard.notification;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finops.guard.config.MetricsConfig;
import com.finops.guard.config.TeamsNotificationConfig;
import com.finops.guard.exception.DeliveryException;
import com.finops.guard.model.ReportPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;

/**
 * Posts the weekly report to a Microsoft Teams incoming webhook.
 */
@Service
public class TeamsWebhookNotifier implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(TeamsWebhookNotifier.class);
    private static final String CHANNEL = "teams";

    private final TeamsNotificationConfig config;
    private final TeamsMessageCardRenderer renderer;
    private final MetricsConfig metricsConfig;
    private final RestClient restClient;

    public TeamsWebhookNotifier(TeamsNotificationConfig config,
                                TeamsMessageCardRenderer renderer,
                                MetricsConfig metricsConfig) {
        this.config = config;
        this.renderer = renderer;
        this.metricsConfig = metricsConfig;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        requestFactory.setReadTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();

        if (config.isConfigured()) {
            log.info("Teams notifier configured (timeout={}s)", config.getTimeoutSeconds());
        } else {
            log.info("Teams notifier is DISABLED: no webhook URL configured.");
        }
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public void deliver(ReportPayload report) {
        if (!isConfigured()) {
            throw new IllegalStateException("Teams webhook URL is not configured");
        }

        ObjectNode card = renderer.render(report);
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(config.getWebhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(card.toString())
                    .retrieve()
                    .toBodilessEntity();

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryException("Teams webhook returned " + response.getStatusCode().value(),
                        response.getStatusCode().value(), null);
            }

            metricsConfig.recordNotification(CHANNEL, "success");
            log.info("Teams report delivered: anomalies={}, status={}",
                    report.getAnomalies().size(), response.getStatusCode().value());
        } catch (RestClientResponseException e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            throw new DeliveryException("Teams webhook returned " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            throw new DeliveryException("Teams webhook unreachable: " + e.getMessage(), e);
        } catch (DeliveryException e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            throw e;
        }
    }
}
