package com.ledgerly.backend.chatbot.responses;

import java.util.List;
import java.util.Set;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.UpcomingBillDTO;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

/**
 * Upcoming bills, inferred from last month's recurring expenses.
 */
@Component
@Order(80)
public class BillRemindersResponseBuilder implements ResponseBuilder {

    private final LedgerAggregator ledgerAggregator;
    private final ChatbotProperties properties;

    public BillRemindersResponseBuilder(LedgerAggregator ledgerAggregator, ChatbotProperties properties) {
        this.ledgerAggregator = ledgerAggregator;
        this.properties = properties;
    }

    @Override
    public Set<String> intents() {
        return Set.of(IntentCatalog.BILL_REMINDERS);
    }

    @Override
    public ChatReply build(ResponseContext context) {
        int horizon = properties.billHorizonDays();
        List<UpcomingBillDTO> bills = ledgerAggregator.upcomingBills(context.userId(), horizon);
        if (bills.isEmpty()) {
            return ChatReply.text("You have no recurring bills due in the next " + horizon + " days.");
        }

        StringBuilder text = new StringBuilder("Upcoming Bills:\n\n");
        for (UpcomingBillDTO bill : bills) {
            text.append("• ").append(billName(bill))
                    .append(" - ").append(dueIn(bill.getDaysUntilDue()))
                    .append(" - ").append(ChatFormatting.formatCurrency(bill.getAmount())).append('\n');
        }
        text.append("\nWould you like me to set up automatic reminders?");
        return ChatReply.text(text.toString());
    }

    private static String billName(UpcomingBillDTO bill) {
        if (bill.getMerchantName() != null && !bill.getMerchantName().isBlank()) {
            return bill.getMerchantName();
        }
        return bill.getDescription();
    }

    static String dueIn(long days) {
        if (days <= 0) {
            return "Due today";
        }
        return days == 1 ? "Due in 1 day" : "Due in " + days + " days";
    }
}
