package com.ledgerly.backend.services.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.BalanceSummaryDTO;
import com.ledgerly.backend.dto.ledger.CategoryBreakdownDTO;
import com.ledgerly.backend.dto.ledger.MonthlyPointDTO;
import com.ledgerly.backend.dto.ledger.SavingsAllocationDTO;
import com.ledgerly.backend.dto.ledger.SpendingBreakdownDTO;
import com.ledgerly.backend.dto.ledger.TransactionSummaryDTO;
import com.ledgerly.backend.dto.ledger.UpcomingBillDTO;
import com.ledgerly.backend.entities.Account;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.enums.AccountKind;
import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;
import com.ledgerly.backend.repositories.AccountRepository;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;

@ExtendWith(MockitoExtension.class)
class LedgerAggregatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 15);

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private LedgerTransactionRepository transactionRepository;

    private LedgerAggregator aggregator;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC);
        aggregator = new LedgerAggregator(accountRepository, transactionRepository, ChatbotProperties.defaults(), clock);
    }

    private static Account account(String name, AccountKind kind, String balance) {
        return Account.builder()
                .id(UUID.randomUUID())
                .name(name)
                .kind(kind)
                .currentBalance(new BigDecimal(balance))
                .build();
    }

    private static LedgerTransaction tx(TransactionType type, TransactionCategory category, String amount, LocalDate date) {
        return LedgerTransaction.builder()
                .id(UUID.randomUUID())
                .type(type)
                .category(category)
                .amount(new BigDecimal(amount))
                .description(category.displayName())
                .transactionDate(date)
                .createdAt(date.atStartOfDay())
                .build();
    }

    private static LedgerTransaction bill(String description, String merchant, String amount, LocalDate paidOn) {
        LedgerTransaction tx = tx(TransactionType.EXPENSE, TransactionCategory.BILLS_UTILITIES, amount, paidOn);
        tx.setDescription(description);
        tx.setMerchantName(merchant);
        tx.setRecurring(true);
        return tx;
    }

    @Test
    void accountBalances_excludesCreditAccountsFromTotal() {
        when(accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId)).thenReturn(List.of(
                account("Checking", AccountKind.CHECKING, "1000.00"),
                account("Savings", AccountKind.SAVINGS, "500.00"),
                account("Visa", AccountKind.CREDIT_CARD, "200.00")));

        BalanceSummaryDTO summary = aggregator.accountBalances(userId);

        assertEquals(3, summary.getAccounts().size());
        assertEquals(new BigDecimal("1500.00"), summary.getTotal());
        assertEquals("Checking", summary.getAccounts().get(0).getName());
    }

    @Test
    void accountBalances_noAccounts_returnsZeroTotal() {
        when(accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId)).thenReturn(List.of());

        BalanceSummaryDTO summary = aggregator.accountBalances(userId);

        assertTrue(summary.getAccounts().isEmpty());
        assertEquals(new BigDecimal("0.00"), summary.getTotal());
    }

    @Test
    void categoryBreakdown_sortsByAmountDescending() {
        DateWindow window = aggregator.lastDays(30);
        when(transactionRepository.findByAccountUserIdAndTypeAndTransactionDateBetween(
                userId, TransactionType.EXPENSE, window.from(), window.to())).thenReturn(List.of(
                tx(TransactionType.EXPENSE, TransactionCategory.TRANSPORTATION, "10.00", TODAY),
                tx(TransactionType.EXPENSE, TransactionCategory.FOOD_DINING, "40.00", TODAY),
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "30.00", TODAY),
                tx(TransactionType.EXPENSE, TransactionCategory.FOOD_DINING, "20.00", TODAY)));

        SpendingBreakdownDTO breakdown = aggregator.categoryBreakdown(userId, window);

        assertEquals(new BigDecimal("100.00"), breakdown.getTotal());
        List<CategoryBreakdownDTO> categories = breakdown.getCategories();
        assertEquals(List.of(TransactionCategory.FOOD_DINING, TransactionCategory.SHOPPING, TransactionCategory.TRANSPORTATION),
                categories.stream().map(CategoryBreakdownDTO::getCategory).toList());
        assertEquals(new BigDecimal("60.00"), categories.get(0).getAmount());
        assertEquals(new BigDecimal("60.00"), categories.get(0).getPercentage());
        assertEquals(2, breakdown.top(2).size());
    }

    @Test
    void categoryBreakdown_percentagesNeverExceedHundred() {
        DateWindow window = aggregator.lastDays(30);
        when(transactionRepository.findByAccountUserIdAndTypeAndTransactionDateBetween(
                userId, TransactionType.EXPENSE, window.from(), window.to())).thenReturn(List.of(
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "10.00", TODAY),
                tx(TransactionType.EXPENSE, TransactionCategory.FOOD_DINING, "10.00", TODAY),
                tx(TransactionType.EXPENSE, TransactionCategory.ENTERTAINMENT, "10.00", TODAY)));

        SpendingBreakdownDTO breakdown = aggregator.categoryBreakdown(userId, window);

        BigDecimal sum = breakdown.getCategories().stream()
                .map(CategoryBreakdownDTO::getPercentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertTrue(sum.compareTo(new BigDecimal("100")) <= 0);
        assertEquals(new BigDecimal("33.33"), breakdown.getCategories().get(0).getPercentage());
        // equal amounts keep enum order
        assertEquals(TransactionCategory.FOOD_DINING, breakdown.getCategories().get(0).getCategory());
    }

    @Test
    void categoryBreakdown_noExpenses_returnsEmpty() {
        DateWindow window = aggregator.lastDays(30);
        when(transactionRepository.findByAccountUserIdAndTypeAndTransactionDateBetween(
                userId, TransactionType.EXPENSE, window.from(), window.to())).thenReturn(List.of());

        SpendingBreakdownDTO breakdown = aggregator.categoryBreakdown(userId, window);

        assertEquals(new BigDecimal("0.00"), breakdown.getTotal());
        assertTrue(!breakdown.hasCategories());
    }

    @Test
    void monthlyTrend_returnsOldestFirstWithZeroFilledMonths() {
        when(transactionRepository.findByAccountUserIdAndTransactionDateBetween(
                userId, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 5, 31))).thenReturn(List.of(
                tx(TransactionType.INCOME, TransactionCategory.SALARY, "1000.00", LocalDate.of(2024, 5, 2)),
                tx(TransactionType.EXPENSE, TransactionCategory.FOOD_DINING, "300.00", LocalDate.of(2024, 5, 10)),
                tx(TransactionType.TRANSFER, TransactionCategory.TRANSFER_OUT, "250.00", LocalDate.of(2024, 5, 11)),
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "80.00", LocalDate.of(2024, 3, 20))));

        List<MonthlyPointDTO> trend = aggregator.monthlyTrend(userId, 3);

        assertEquals(List.of("2024-03", "2024-04", "2024-05"), trend.stream().map(MonthlyPointDTO::getMonth).toList());
        MonthlyPointDTO may = trend.get(2);
        assertEquals(new BigDecimal("1000.00"), may.getIncome());
        assertEquals(new BigDecimal("300.00"), may.getExpenses());
        assertEquals(new BigDecimal("700.00"), may.getNet());
        assertEquals(new BigDecimal("0.00"), trend.get(1).getNet());
        assertEquals(new BigDecimal("-80.00"), trend.get(0).getNet());
    }

    @Test
    void transactionSummary_totalsCountTopCategoriesAndTrend() {
        LocalDate from = LocalDate.of(2024, 5, 1);
        LocalDate to = LocalDate.of(2024, 5, 31);
        List<LedgerTransaction> txs = List.of(
                tx(TransactionType.INCOME, TransactionCategory.SALARY, "3000.00", LocalDate.of(2024, 5, 1)),
                tx(TransactionType.EXPENSE, TransactionCategory.FOOD_DINING, "120.00", LocalDate.of(2024, 5, 3)),
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "300.00", LocalDate.of(2024, 5, 4)),
                tx(TransactionType.EXPENSE, TransactionCategory.TRANSPORTATION, "40.00", LocalDate.of(2024, 5, 5)),
                tx(TransactionType.EXPENSE, TransactionCategory.ENTERTAINMENT, "30.00", LocalDate.of(2024, 5, 6)),
                tx(TransactionType.EXPENSE, TransactionCategory.HEALTHCARE, "20.00", LocalDate.of(2024, 5, 7)),
                tx(TransactionType.EXPENSE, TransactionCategory.EDUCATION, "10.00", LocalDate.of(2024, 5, 8)),
                tx(TransactionType.TRANSFER, TransactionCategory.TRANSFER_OUT, "500.00", LocalDate.of(2024, 5, 9)));
        when(transactionRepository.search(eq(userId), isNull(), isNull(), isNull(), isNull(), isNull(),
                eq(from), eq(to), isNull(), isNull(), any(Pageable.class))).thenReturn(new PageImpl<>(txs));

        TransactionSummaryDTO summary = aggregator.transactionSummary(userId, from, to);

        assertEquals(new BigDecimal("3000.00"), summary.getTotalIncome());
        assertEquals(new BigDecimal("520.00"), summary.getTotalExpenses());
        assertEquals(new BigDecimal("2480.00"), summary.getNetIncome());
        assertEquals(8, summary.getTransactionCount());
        assertEquals(List.of(TransactionCategory.SHOPPING, TransactionCategory.FOOD_DINING,
                        TransactionCategory.TRANSPORTATION, TransactionCategory.ENTERTAINMENT, TransactionCategory.HEALTHCARE),
                summary.getTopCategories().stream().map(CategoryBreakdownDTO::getCategory).toList());
        assertEquals(6, summary.getMonthlyTrend().size());
        assertEquals("2024-05", summary.getMonthlyTrend().get(5).getMonth());
    }

    @Test
    void transactionSummary_openRange_queriesWithoutDateBounds() {
        when(transactionRepository.search(eq(userId), isNull(), isNull(), isNull(), isNull(), isNull(),
                isNull(), isNull(), isNull(), isNull(), any(Pageable.class))).thenReturn(Page.empty());

        TransactionSummaryDTO summary = aggregator.transactionSummary(userId, null, null);

        assertEquals(new BigDecimal("0.00"), summary.getNetIncome());
        assertEquals(0, summary.getTransactionCount());
        assertTrue(summary.getTopCategories().isEmpty());
    }

    @Test
    void transactionSummary_invertedRange_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.transactionSummary(userId, LocalDate.of(2024, 6, 1), LocalDate.of(2024, 5, 1)));
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void monthlyTrend_withoutMonths_usesConfiguredTrendMonths() {
        ChatbotProperties properties = new ChatbotProperties(null, null, null, null, null, 4, null, null, null);
        Clock clock = Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC);
        LedgerAggregator configured = new LedgerAggregator(accountRepository, transactionRepository, properties, clock);
        when(transactionRepository.findByAccountUserIdAndTransactionDateBetween(
                userId, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 5, 31))).thenReturn(List.of());

        List<MonthlyPointDTO> trend = configured.monthlyTrend(userId);

        assertEquals(List.of("2024-02", "2024-03", "2024-04", "2024-05"),
                trend.stream().map(MonthlyPointDTO::getMonth).toList());
    }

    @Test
    void monthlyTrend_nonPositiveMonths_throws() {
        assertThrows(IllegalArgumentException.class, () -> aggregator.monthlyTrend(userId, 0));
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void savingsAllocation_positiveNet_splitsFiftyThirtyTwenty() {
        Optional<SavingsAllocationDTO> allocation = aggregator.savingsAllocation(new BigDecimal("1000.00"));

        assertTrue(allocation.isPresent());
        assertEquals(new BigDecimal("500.00"), allocation.get().getEmergencyFund());
        assertEquals(new BigDecimal("300.00"), allocation.get().getLongTerm());
        assertEquals(new BigDecimal("200.00"), allocation.get().getDiscretionary());
    }

    @Test
    void savingsAllocation_zeroOrNegativeNet_isEmpty() {
        assertTrue(aggregator.savingsAllocation(new BigDecimal("0.00")).isEmpty());
        assertTrue(aggregator.savingsAllocation(new BigDecimal("-5.00")).isEmpty());
        assertTrue(aggregator.savingsAllocation(null).isEmpty());
    }

    @Test
    void searchTransactions_usesToleranceBandAroundAmount() {
        when(transactionRepository.findByAccountUserIdAndAmountBetweenOrderByTransactionDateDescCreatedAtDesc(
                eq(userId), any(BigDecimal.class), any(BigDecimal.class), any(Pageable.class))).thenReturn(List.of());

        aggregator.searchTransactions(userId, List.of(new BigDecimal("45")), new BigDecimal("0.10"), 10);

        ArgumentCaptor<BigDecimal> lower = ArgumentCaptor.forClass(BigDecimal.class);
        ArgumentCaptor<BigDecimal> upper = ArgumentCaptor.forClass(BigDecimal.class);
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(transactionRepository).findByAccountUserIdAndAmountBetweenOrderByTransactionDateDescCreatedAtDesc(
                eq(userId), lower.capture(), upper.capture(), page.capture());
        assertEquals(0, lower.getValue().compareTo(new BigDecimal("40.50")));
        assertEquals(0, upper.getValue().compareTo(new BigDecimal("49.50")));
        assertEquals(10, page.getValue().getPageSize());
    }

    @Test
    void searchTransactions_mergesBandsNewestFirstWithoutDuplicates() {
        LedgerTransaction older = tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "44.00", TODAY.minusDays(9));
        LedgerTransaction shared = tx(TransactionType.EXPENSE, TransactionCategory.FOOD_DINING, "47.00", TODAY.minusDays(3));
        LedgerTransaction newest = tx(TransactionType.EXPENSE, TransactionCategory.TRAVEL, "50.00", TODAY);
        LedgerTransaction sameDayEarlier = tx(TransactionType.EXPENSE, TransactionCategory.TRAVEL, "49.00", TODAY);
        sameDayEarlier.setCreatedAt(LocalDateTime.of(2024, 5, 14, 23, 0));

        when(transactionRepository.findByAccountUserIdAndAmountBetweenOrderByTransactionDateDescCreatedAtDesc(
                eq(userId), any(BigDecimal.class), any(BigDecimal.class), any(Pageable.class)))
                .thenReturn(List.of(shared, older))
                .thenReturn(List.of(newest, shared, sameDayEarlier));

        List<LedgerTransaction> result = aggregator.searchTransactions(
                userId, List.of(new BigDecimal("45"), new BigDecimal("50")), new BigDecimal("0.10"), 10);

        assertEquals(List.of(newest, sameDayEarlier, shared, older), result);
    }

    @Test
    void searchTransactions_respectsLimit() {
        List<LedgerTransaction> many = List.of(
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "45.00", TODAY),
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "45.00", TODAY.minusDays(1)),
                tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "45.00", TODAY.minusDays(2)));
        when(transactionRepository.findByAccountUserIdAndAmountBetweenOrderByTransactionDateDescCreatedAtDesc(
                eq(userId), any(BigDecimal.class), any(BigDecimal.class), any(Pageable.class))).thenReturn(many);

        List<LedgerTransaction> result = aggregator.searchTransactions(
                userId, List.of(new BigDecimal("45"), new BigDecimal("46")), new BigDecimal("0.10"), 2);

        assertEquals(2, result.size());
        assertEquals(TODAY, result.get(0).getTransactionDate());
    }

    @Test
    void searchTransactions_withoutAmounts_returnsMostRecent() {
        LedgerTransaction latest = tx(TransactionType.EXPENSE, TransactionCategory.SHOPPING, "12.00", TODAY);
        when(transactionRepository.findByAccountUserIdOrderByTransactionDateDescCreatedAtDesc(eq(userId), any(Pageable.class)))
                .thenReturn(List.of(latest));

        List<LedgerTransaction> result = aggregator.searchTransactions(userId, List.of(), new BigDecimal("0.10"), 10);

        assertEquals(List.of(latest), result);
    }

    @Test
    void upcomingBills_projectsLatestPaymentOneMonthAheadAndSortsByDueDate() {
        when(transactionRepository.findByAccountUserIdAndTypeAndRecurringTrueAndTransactionDateBetween(
                userId, TransactionType.EXPENSE, LocalDate.of(2024, 4, 15), LocalDate.of(2024, 5, 14))).thenReturn(List.of(
                bill("Rent", "Landlord LLC", "1500.00", LocalDate.of(2024, 5, 1)),
                bill("Netflix", "Netflix", "15.99", LocalDate.of(2024, 4, 20)),
                bill("NETFLIX ", "netflix", "17.99", LocalDate.of(2024, 4, 25)),
                bill("Gym", "FitClub", "40.00", LocalDate.of(2024, 4, 10))));

        List<UpcomingBillDTO> bills = aggregator.upcomingBills(userId, 30);

        assertEquals(2, bills.size());
        UpcomingBillDTO netflix = bills.get(0);
        assertEquals(new BigDecimal("17.99"), netflix.getAmount());
        assertEquals(LocalDate.of(2024, 5, 25), netflix.getDueDate());
        assertEquals(10, netflix.getDaysUntilDue());
        UpcomingBillDTO rent = bills.get(1);
        assertEquals("Landlord LLC", rent.getMerchantName());
        assertEquals(LocalDate.of(2024, 6, 1), rent.getDueDate());
        assertEquals(17, rent.getDaysUntilDue());
    }

    @Test
    void upcomingBills_sameDueDate_largerAmountFirst() {
        when(transactionRepository.findByAccountUserIdAndTypeAndRecurringTrueAndTransactionDateBetween(
                eq(userId), eq(TransactionType.EXPENSE), any(LocalDate.class), any(LocalDate.class))).thenReturn(List.of(
                bill("Phone", "Verizon", "65.00", LocalDate.of(2024, 4, 20)),
                bill("Insurance", "Geico", "120.00", LocalDate.of(2024, 4, 20))));

        List<UpcomingBillDTO> bills = aggregator.upcomingBills(userId, 30);

        assertEquals(List.of("Insurance", "Phone"), bills.stream().map(UpcomingBillDTO::getDescription).toList());
    }
}
