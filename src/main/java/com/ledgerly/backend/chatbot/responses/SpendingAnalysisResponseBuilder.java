package com.ledgerly.backend.chatbot.responses;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.CategoryBreakdownDTO;
import com.ledgerly.backend.dto.ledger.SpendingBreakdownDTO;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

/**
 * Expense breakdown over the analysis window. The text lists the top categories; the chart
 * carries all of them.
 */
@Component
@Order(30)
public class SpendingAnalysisResponseBuilder implements ResponseBuilder {

    static final String CHART_TITLE = "Spending by Category";

    private final LedgerAggregator ledgerAggregator;
    private final ChatbotProperties properties;

    public SpendingAnalysisResponseBuilder(LedgerAggregator ledgerAggregator, ChatbotProperties properties) {
        this.ledgerAggregator = ledgerAggregator;
        this.properties = properties;
    }

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.SPENDING_ANALYSIS);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        int days = properties.analysisWindowDays();
        SpendingBreakdownDTO breakdown = ledgerAggregator.categoryBreakdown(context.userId(), ledgerAggregator.lastDays(days));
        if (!breakdown.hasCategories()) {
            return ChatReply.text("No expenses found for the specified period.");
        }

        StringBuilder text = new StringBuilder();
        text.append("Spending Analysis (Last ").append(days).append(" Days):\n");
        text.append("Total Spent: ").append(ChatFormatting.formatCurrency(breakdown.getTotal())).append("\n\n");
        text.append("Top Categories:\n");
        for (CategoryBreakdownDTO entry : breakdown.top(properties.breakdownTopCategories())) {
            text.append("• ").append(entry.getCategory().displayName()).append(": ")
                    .append(ChatFormatting.formatCurrency(entry.getAmount()))
                    .append(" (").append(ChatFormatting.formatPercent(entry.getPercentage())).append(")\n");
        }

        List<String> labels = breakdown.getCategories().stream().map(c -> c.getCategory().displayName()).toList();
        List<BigDecimal> values = breakdown.getCategories().stream().map(CategoryBreakdownDTO::getAmount).toList();
        return ChatReply.withChart(text.toString(), ChartPayload.of(ChartPayload.DOUGHNUT, CHART_TITLE, labels, values));
    }
}
