package com.ledgerly.backend.chatbot.entities;

import java.util.List;
import java.util.Locale;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class CategoryKeywordContributor implements StructuredEntityContributor {

    /** Matched as plain substrings of the lowercased message, in this order. */
    public static final List<String> VOCABULARY = List.of(
            "food", "dining", "restaurant", "grocery", "shopping", "gas", "transportation",
            "entertainment", "bills", "utilities", "healthcare", "insurance", "rent",
            "mortgage", "salary", "income", "investment", "savings"
    );

    @Override
    public void contribute(String message, List<ExtractedEntity> namedEntities, StructuredEntities.Builder entities) {
        if (message == null || message.isEmpty()) {
            return;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String keyword : VOCABULARY) {
            if (lower.contains(keyword)) {
                entities.category(keyword);
            }
        }
    }
}
