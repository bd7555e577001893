package com.ledgerly.backend.chatbot;

import java.util.List;

import com.ledgerly.backend.chatbot.entities.ExtractedEntity;

/**
 * Per-message analysis outcome. Not persisted.
 */
public record ClassificationResult(String intent, double confidence, List<ExtractedEntity> entities) {

    public ClassificationResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
