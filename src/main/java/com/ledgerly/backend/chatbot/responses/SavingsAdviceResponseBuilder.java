package com.ledgerly.backend.chatbot.responses;

import java.util.Optional;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.CashFlowDTO;
import com.ledgerly.backend.dto.ledger.SavingsAllocationDTO;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

@Component
@Order(50)
public class SavingsAdviceResponseBuilder implements ResponseBuilder {

    private final LedgerAggregator ledgerAggregator;
    private final ChatbotProperties properties;

    public SavingsAdviceResponseBuilder(LedgerAggregator ledgerAggregator, ChatbotProperties properties) {
        this.ledgerAggregator = ledgerAggregator;
        this.properties = properties;
    }

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.SAVINGS_ADVICE);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        CashFlowDTO flow = ledgerAggregator.cashFlow(
                context.userId(), ledgerAggregator.lastDays(properties.analysisWindowDays()));

        StringBuilder text = new StringBuilder("Savings Analysis:\n\n");
        text.append("Monthly Income: ").append(ChatFormatting.formatCurrency(flow.getIncome())).append('\n');
        text.append("Monthly Expenses: ").append(ChatFormatting.formatCurrency(flow.getExpenses())).append('\n');
        text.append("Net Income: ").append(ChatFormatting.formatCurrency(flow.getNet())).append("\n\n");

        Optional<SavingsAllocationDTO> allocation = ledgerAggregator.savingsAllocation(flow.getNet());
        if (allocation.isPresent()) {
            SavingsAllocationDTO split = allocation.get();
            text.append("Great! You have ").append(ChatFormatting.formatCurrency(flow.getNet()))
                    .append(" left over each month.\n\n");
            text.append("Savings Suggestions:\n");
            text.append("• Emergency fund: Save ").append(ChatFormatting.formatCurrency(split.getEmergencyFund()))
                    .append("/month\n");
            text.append("• Long-term goals: Save ").append(ChatFormatting.formatCurrency(split.getLongTerm()))
                    .append("/month\n");
            text.append("• Fun money: Keep ").append(ChatFormatting.formatCurrency(split.getDiscretionary()))
                    .append("/month flexible");
        } else {
            text.append("You're spending more than you earn. Consider:\n");
            text.append("• Review your largest expenses\n");
            text.append("• Look for subscription services to cancel\n");
            text.append("• Find ways to increase your income");
        }
        return ChatReply.text(text.toString());
    }
}
