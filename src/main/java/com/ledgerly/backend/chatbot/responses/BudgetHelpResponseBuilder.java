package com.ledgerly.backend.chatbot.responses;

import java.math.BigDecimal;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.SpendingBreakdownDTO;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

@Component
@Order(40)
public class BudgetHelpResponseBuilder implements ResponseBuilder {

    static final BigDecimal EMERGENCY_FUND_MONTHS = BigDecimal.valueOf(3);
    static final BigDecimal SUGGESTED_SAVINGS_RATE = new BigDecimal("0.20");

    private final LedgerAggregator ledgerAggregator;
    private final ChatbotProperties properties;

    public BudgetHelpResponseBuilder(LedgerAggregator ledgerAggregator, ChatbotProperties properties) {
        this.ledgerAggregator = ledgerAggregator;
        this.properties = properties;
    }

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.BUDGET_HELP);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        SpendingBreakdownDTO breakdown = ledgerAggregator.categoryBreakdown(
                context.userId(), ledgerAggregator.lastDays(properties.analysisWindowDays()));
        if (!breakdown.hasCategories()) {
            return ChatReply.text("I need some transaction data to provide budget advice. Start by adding some expenses!");
        }

        BigDecimal monthly = breakdown.getTotal();
        String text = "Budget Advice:\n\n"
                + "Your monthly spending: " + ChatFormatting.formatCurrency(monthly) + "\n\n"
                + "Recommendations:\n"
                + "• Emergency fund goal: " + ChatFormatting.formatCurrency(monthly.multiply(EMERGENCY_FUND_MONTHS))
                + " (3 months expenses)\n"
                + "• Suggested monthly savings: " + ChatFormatting.formatCurrency(monthly.multiply(SUGGESTED_SAVINGS_RATE))
                + " (20% of expenses)\n"
                + "• Consider the 50/30/20 rule: 50% needs, 30% wants, 20% savings\n"
                + "• Review your largest expense categories for potential savings";
        return ChatReply.text(text);
    }
}
