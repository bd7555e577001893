package com.ledgerly.backend.chatbot.responses;

import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;

@Component
@Order(70)
public class FinancialGoalsResponseBuilder implements ResponseBuilder {

    static final String GUIDANCE = "Financial Goals Help:\n\n"
            + "I can help you set and track goals like:\n"
            + "• Emergency fund (3-6 months expenses)\n"
            + "• Vacation savings\n"
            + "• Home down payment\n"
            + "• Debt payoff\n"
            + "• Retirement savings\n\n"
            + "Would you like to create a new goal or check progress on existing ones?";

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.FINANCIAL_GOALS);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        return ChatReply.text(GUIDANCE);
    }
}
