package com.ledgerly.backend.chatbot.responses;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

/**
 * Lists recent transactions, narrowed to amounts near the ones mentioned in the message.
 */
@Component
@Order(60)
public class TransactionSearchResponseBuilder implements ResponseBuilder {

    static final String VIEW_ACTION = "view_transaction";

    private final LedgerAggregator ledgerAggregator;
    private final ChatbotProperties properties;

    public TransactionSearchResponseBuilder(LedgerAggregator ledgerAggregator, ChatbotProperties properties) {
        this.ledgerAggregator = ledgerAggregator;
        this.properties = properties;
    }

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.TRANSACTION_SEARCH);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        List<LedgerTransaction> matches = ledgerAggregator.searchTransactions(
                context.userId(),
                context.entities().amounts(),
                properties.searchAmountTolerance(),
                properties.searchResultLimit());

        if (matches.isEmpty()) {
            return ChatReply.text("No transactions found matching your criteria.");
        }

        StringBuilder text = new StringBuilder();
        text.append("Found ").append(matches.size()).append(" recent transactions:\n\n");
        for (LedgerTransaction tx : matches) {
            text.append("• ")
                    .append(tx.getTransactionDate() != null ? tx.getTransactionDate().format(ChatFormatting.SHORT_DATE) : "--/--")
                    .append(" - ").append(tx.getDescription()).append(": ")
                    .append(ChatFormatting.formatCurrency(tx.getAmount())).append('\n');
        }

        List<Map<String, Object>> actions = matches.stream()
                .limit(properties.searchActionLimit())
                .map(TransactionSearchResponseBuilder::viewAction)
                .toList();
        return ChatReply.withActions(text.toString(), actions);
    }

    private static Map<String, Object> viewAction(LedgerTransaction tx) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", VIEW_ACTION);
        action.put("id", String.valueOf(tx.getId()));
        action.put("label", "View " + ChatFormatting.formatCurrency(tx.getAmount()));
        return action;
    }
}
