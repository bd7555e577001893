package com.ledgerly.backend.chatbot.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ledgerly.backend.chatbot.entities.ExtractedEntity;
import com.ledgerly.backend.chatbot.responses.ChartPayload;

/**
 * {@code chartData} and {@code actions} are omitted when the answer has none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponseDTO(
        String response,
        String intent,
        double confidence,
        List<ExtractedEntity> entities,
        String conversationId,
        ChartPayload chartData,
        List<Map<String, Object>> actions
) {}
