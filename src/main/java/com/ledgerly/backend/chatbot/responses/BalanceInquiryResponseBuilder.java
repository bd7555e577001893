package com.ledgerly.backend.chatbot.responses;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.dto.ledger.AccountBalanceDTO;
import com.ledgerly.backend.dto.ledger.BalanceSummaryDTO;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

@Component
@Order(20)
public class BalanceInquiryResponseBuilder implements ResponseBuilder {

    static final String CHART_TITLE = "Account Balances";

    private final LedgerAggregator ledgerAggregator;

    public BalanceInquiryResponseBuilder(LedgerAggregator ledgerAggregator) {
        this.ledgerAggregator = ledgerAggregator;
    }

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.BALANCE_INQUIRY);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        BalanceSummaryDTO summary = ledgerAggregator.accountBalances(context.userId());
        List<AccountBalanceDTO> accounts = summary.getAccounts();

        StringBuilder text = new StringBuilder("Here are your current account balances:\n");
        if (accounts.isEmpty()) {
            text.append("You don't have any active accounts.");
            return ChatReply.text(text.toString());
        }

        for (AccountBalanceDTO account : accounts) {
            text.append("• ").append(account.getName()).append(": ")
                    .append(ChatFormatting.formatCurrency(account.getCurrentBalance())).append('\n');
        }
        text.append("\nTotal Balance: ").append(ChatFormatting.formatCurrency(summary.getTotal()));

        List<String> labels = accounts.stream().map(AccountBalanceDTO::getName).toList();
        List<BigDecimal> values = accounts.stream().map(AccountBalanceDTO::getCurrentBalance).toList();
        return ChatReply.withChart(text.toString(), ChartPayload.of(ChartPayload.PIE, CHART_TITLE, labels, values));
    }
}
