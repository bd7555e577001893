package com.ledgerly.backend.chatbot.responses;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ledgerly.backend.chatbot.entities.StructuredEntities;
import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.chatbot.intent.IntentMatch;
import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.CashFlowDTO;
import com.ledgerly.backend.dto.ledger.SavingsAllocationDTO;
import com.ledgerly.backend.services.ledger.DateWindow;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

@ExtendWith(MockitoExtension.class)
class SavingsAdviceResponseBuilderTest {

    @Mock
    private LedgerAggregator ledgerAggregator;

    private SavingsAdviceResponseBuilder builder;
    private final UUID userId = UUID.randomUUID();
    private final DateWindow window = new DateWindow(LocalDate.of(2024, 4, 15), LocalDate.of(2024, 5, 15));

    @BeforeEach
    void setUp() {
        builder = new SavingsAdviceResponseBuilder(ledgerAggregator, ChatbotProperties.defaults());
        when(ledgerAggregator.lastDays(30)).thenReturn(window);
    }

    private ResponseContext context() {
        return new ResponseContext(userId, "how to save", new IntentMatch(IntentCatalog.SAVINGS_ADVICE, 1.0),
                StructuredEntities.empty());
    }

    private static CashFlowDTO flow(String income, String expenses) {
        BigDecimal in = new BigDecimal(income);
        BigDecimal out = new BigDecimal(expenses);
        return CashFlowDTO.builder().income(in).expenses(out).net(in.subtract(out)).build();
    }

    @Test
    void build_surplus_suggestsSplit() {
        CashFlowDTO flow = flow("3000.00", "2000.00");
        when(ledgerAggregator.cashFlow(userId, window)).thenReturn(flow);
        when(ledgerAggregator.savingsAllocation(flow.getNet())).thenReturn(Optional.of(SavingsAllocationDTO.builder()
                .emergencyFund(new BigDecimal("500.00"))
                .longTerm(new BigDecimal("300.00"))
                .discretionary(new BigDecimal("200.00"))
                .build()));

        String text = builder.build(context()).text();

        assertTrue(text.contains("Net Income: $1,000.00"));
        assertTrue(text.contains("Great! You have $1,000.00 left over each month."));
        assertTrue(text.contains("• Emergency fund: Save $500.00/month"));
        assertTrue(text.contains("• Long-term goals: Save $300.00/month"));
        assertTrue(text.contains("• Fun money: Keep $200.00/month flexible"));
    }

    @Test
    void build_deficit_suggestsCuttingCosts() {
        CashFlowDTO flow = flow("1000.00", "1500.00");
        when(ledgerAggregator.cashFlow(userId, window)).thenReturn(flow);
        when(ledgerAggregator.savingsAllocation(flow.getNet())).thenReturn(Optional.empty());

        String text = builder.build(context()).text();

        assertTrue(text.contains("You're spending more than you earn."));
        assertFalse(text.contains("Savings Suggestions"));
    }
}
