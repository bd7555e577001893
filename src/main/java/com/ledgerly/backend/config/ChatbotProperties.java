package com.ledgerly.backend.config;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Product policy constants for the chat answers. Loaded from "ledgerly.chatbot.*".
 *
 * Example:
 * ledgerly.chatbot.search-amount-tolerance=0.10
 * ledgerly.chatbot.savings-split.emergency=0.50
 */
@ConfigurationProperties(prefix = "ledgerly.chatbot")
public record ChatbotProperties(
        Integer analysisWindowDays,
        BigDecimal searchAmountTolerance,
        Integer searchResultLimit,
        Integer searchActionLimit,
        Integer breakdownTopCategories,
        Integer trendMonths,
        Integer billHorizonDays,
        SavingsSplit savingsSplit,
        List<String> suggestions
) {
    public ChatbotProperties {
        if (analysisWindowDays == null || analysisWindowDays <= 0) {
            analysisWindowDays = 30;
        }
        if (searchAmountTolerance == null || searchAmountTolerance.signum() < 0) {
            searchAmountTolerance = new BigDecimal("0.10");
        }
        if (searchResultLimit == null || searchResultLimit <= 0) {
            searchResultLimit = 10;
        }
        if (searchActionLimit == null || searchActionLimit < 0) {
            searchActionLimit = 3;
        }
        if (breakdownTopCategories == null || breakdownTopCategories <= 0) {
            breakdownTopCategories = 5;
        }
        if (trendMonths == null || trendMonths <= 0) {
            trendMonths = 6;
        }
        if (billHorizonDays == null || billHorizonDays <= 0) {
            billHorizonDays = 30;
        }
        if (savingsSplit == null) {
            savingsSplit = new SavingsSplit(null, null, null);
        }
        if (suggestions == null || suggestions.isEmpty()) {
            suggestions = List.of(
                    "What's my spending this month?",
                    "Show me my account balances",
                    "Help me create a budget",
                    "What are my upcoming bills?",
                    "How can I save more money?"
            );
        }
    }

    public static ChatbotProperties defaults() {
        return new ChatbotProperties(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Split of a positive monthly net flow into savings buckets.
     */
    public record SavingsSplit(BigDecimal emergency, BigDecimal longTerm, BigDecimal discretionary) {
        public SavingsSplit {
            if (emergency == null) {
                emergency = new BigDecimal("0.50");
            }
            if (longTerm == null) {
                longTerm = new BigDecimal("0.30");
            }
            if (discretionary == null) {
                discretionary = new BigDecimal("0.20");
            }
        }
    }
}
