package com.ledgerly.backend.chatbot.intent;

import java.util.List;

/**
 * One conversational purpose. Pattern order is significant only for readability; response
 * templates are picked at random.
 */
public record IntentDefinition(String name, List<String> patterns, List<String> responseTemplates) {
    public IntentDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (patterns == null || patterns.isEmpty()) throw new IllegalArgumentException("patterns is required");
        patterns = List.copyOf(patterns);
        responseTemplates = responseTemplates == null ? List.of() : List.copyOf(responseTemplates);
    }
}
