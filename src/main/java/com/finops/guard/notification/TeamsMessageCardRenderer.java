package com.finops.guard.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finops.guard.model.Anomaly;
import com.finops.guard.model.Recommendation;
import com.finops.guard.model.ReportPayload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a report as a Teams "MessageCard" connector payload.
 */
@Component
public class TeamsMessageCardRenderer {

    static final int MAX_BULLETS = 5;
    static final String EMPTY_BULLETS = "- none";
    static final String THEME_COLOR = "0078D7";

    private final ObjectMapper objectMapper;

    public TeamsMessageCardRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode render(ReportPayload report) {
        ObjectNode card = objectMapper.createObjectNode();
        card.put("@type", "MessageCard");
        card.put("@context", "https://schema.org/extensions");
        card.put("summary", report.getTitle());
        card.put("themeColor", THEME_COLOR);
        card.put("title", report.getTitle());

        ArrayNode sections = card.putArray("sections");

        ObjectNode overview = sections.addObject();
        overview.put("text", report.getSummary());
        ArrayNode facts = overview.putArray("facts");
        addFact(facts, "Anomaly count",
                String.valueOf((long) report.metric(ReportPayload.METRIC_ANOMALY_COUNT)));
        addFact(facts, "Estimated monthly savings",
                formatUsd(report.metric(ReportPayload.METRIC_ESTIMATED_SAVINGS)));

        ObjectNode anomalies = sections.addObject();
        anomalies.put("title", "Top anomalies");
        anomalies.put("text", toBullets(report.getAnomalies(), Anomaly::getDimension));

        ObjectNode actions = sections.addObject();
        actions.put("title", "Recommended actions");
        actions.put("text", toBullets(report.getRecommendations(), Recommendation::getAction));

        return card;
    }

    static <T> String toBullets(List<T> rows, Function<T, String> label) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY_BULLETS;
        }
        return rows.stream()
                .limit(MAX_BULLETS)
                .map(row -> {
                    String value = label.apply(row);
                    return "- " + (value != null ? value : "n/a");
                })
                .collect(Collectors.joining("\n"));
    }

    static String formatUsd(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    private static void addFact(ArrayNode facts, String name, String value) {
        ObjectNode fact = facts.addObject();
        fact.put("name", name);
        fact.put("value", value);
    }
}
