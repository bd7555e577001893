package com.ledgerly.backend.chatbot.responses;

import java.util.List;
import java.util.Map;

/**
 * What a {@link ResponseBuilder} hands back: the answer text plus an optional chart and optional
 * client actions. Each action is a map with at least a {@code type} key.
 */
public record ChatReply(String text, ChartPayload chartData, List<Map<String, Object>> actions) {

    public ChatReply {
        if (text == null) {
            throw new IllegalArgumentException("text is required");
        }
        actions = actions == null ? null : List.copyOf(actions);
    }

    public static ChatReply text(String text) {
        return new ChatReply(text, null, null);
    }

    public static ChatReply withChart(String text, ChartPayload chartData) {
        return new ChatReply(text, chartData, null);
    }

    public static ChatReply withActions(String text, List<Map<String, Object>> actions) {
        return new ChatReply(text, null, actions);
    }
}
