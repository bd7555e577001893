package com.ledgerly.backend.chatbot.responses;

import java.math.BigDecimal;
import java.util.List;

/**
 * Chart description rendered by the client, e.g. {@code {type: "pie", title: "Account Balances",
 * data: {labels: [...], values: [...]}}}.
 */
public record ChartPayload(String type, String title, ChartData data) {

    public static final String PIE = "pie";
    public static final String DOUGHNUT = "doughnut";

    public static ChartPayload of(String type, String title, List<String> labels, List<BigDecimal> values) {
        return new ChartPayload(type, title, new ChartData(List.copyOf(labels), List.copyOf(values)));
    }

    public record ChartData(List<String> labels, List<BigDecimal> values) {}
}
