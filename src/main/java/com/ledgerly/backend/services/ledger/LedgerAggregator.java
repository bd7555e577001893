package com.ledgerly.backend.services.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerly.backend.config.ChatbotProperties;
import com.ledgerly.backend.dto.ledger.AccountBalanceDTO;
import com.ledgerly.backend.dto.ledger.BalanceSummaryDTO;
import com.ledgerly.backend.dto.ledger.CashFlowDTO;
import com.ledgerly.backend.dto.ledger.CategoryBreakdownDTO;
import com.ledgerly.backend.dto.ledger.MonthlyPointDTO;
import com.ledgerly.backend.dto.ledger.SavingsAllocationDTO;
import com.ledgerly.backend.dto.ledger.SpendingBreakdownDTO;
import com.ledgerly.backend.dto.ledger.TransactionSummaryDTO;
import com.ledgerly.backend.dto.ledger.UpcomingBillDTO;
import com.ledgerly.backend.entities.Account;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;
import com.ledgerly.backend.repositories.AccountRepository;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only summaries over a user's accounts and transactions.
 *
 * Every method queries the repositories afresh; nothing is cached. Empty ledgers produce empty
 * or zero-valued results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class LedgerAggregator {

    static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("yyyy-MM");

    static final Comparator<LedgerTransaction> NEWEST_FIRST = Comparator
            .comparing(LedgerTransaction::getTransactionDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(LedgerTransaction::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final AccountRepository accountRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final ChatbotProperties properties;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public DateWindow lastDays(int days) {
        return DateWindow.lastDays(today(), days);
    }

    public BalanceSummaryDTO accountBalances(UUID userId) {
        List<Account> accounts = accountRepository.findByUserIdAndActiveTrueOrderByCreatedAtAsc(userId);

        List<AccountBalanceDTO> items = new ArrayList<>(accounts.size());
        BigDecimal total = ZERO;
        for (Account account : accounts) {
            BigDecimal balance = account.getCurrentBalance() != null ? account.getCurrentBalance() : ZERO;
            items.add(AccountBalanceDTO.builder()
                    .id(account.getId())
                    .name(account.getName())
                    .currentBalance(balance)
                    .kind(account.getKind())
                    .build());
            if (account.getKind() == null || !account.getKind().isCredit()) {
                total = total.add(balance);
            }
        }

        log.debug("[LedgerAggregator] userId={} accounts={} total={}", userId, items.size(), total);
        return BalanceSummaryDTO.builder()
                .accounts(items)
                .total(total)
                .build();
    }

    /**
     * Expense totals per category over the window, largest first.
     */
    public SpendingBreakdownDTO categoryBreakdown(UUID userId, DateWindow window) {
        List<LedgerTransaction> expenses = transactionRepository.findByAccountUserIdAndTypeAndTransactionDateBetween(
                userId, TransactionType.EXPENSE, window.from(), window.to());

        BigDecimal total = sumByType(expenses, TransactionType.EXPENSE);
        return SpendingBreakdownDTO.builder()
                .from(window.from())
                .to(window.to())
                .total(total)
                .categories(rankCategories(expenses, total))
                .build();
    }

    /**
     * Income, expense and count over an optional date range (either bound may be null), the
     * largest expense categories and the configured monthly trend.
     */
    public TransactionSummaryDTO transactionSummary(UUID userId, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        List<LedgerTransaction> txs = transactionRepository.search(
                userId, null, null, null, null, null, from, to, null, null, Pageable.unpaged()).getContent();

        BigDecimal income = sumByType(txs, TransactionType.INCOME);
        BigDecimal expenses = sumByType(txs, TransactionType.EXPENSE);
        List<CategoryBreakdownDTO> top = rankCategories(txs, expenses).stream()
                .limit(properties.breakdownTopCategories())
                .toList();

        log.debug("[LedgerAggregator] summary userId={} from={} to={} count={}", userId, from, to, txs.size());
        return TransactionSummaryDTO.builder()
                .from(from)
                .to(to)
                .totalIncome(income)
                .totalExpenses(expenses)
                .netIncome(income.subtract(expenses))
                .transactionCount(txs.size())
                .topCategories(top)
                .monthlyTrend(monthlyTrend(userId))
                .build();
    }

    /**
     * Expense totals per category among {@code txs}, largest first, ties in enum order.
     * Percentages are rounded down to two decimals so that the displayed values never add up to
     * more than 100.
     */
    private static List<CategoryBreakdownDTO> rankCategories(List<LedgerTransaction> txs, BigDecimal totalSpent) {
        if (totalSpent.signum() == 0) {
            return Collections.emptyList();
        }
        Map<TransactionCategory, BigDecimal> byCategory = new EnumMap<>(TransactionCategory.class);
        for (LedgerTransaction tx : txs) {
            if (tx == null || tx.getType() != TransactionType.EXPENSE) {
                continue;
            }
            TransactionCategory category = tx.getCategory() != null ? tx.getCategory() : TransactionCategory.OTHER_EXPENSE;
            byCategory.merge(category, safeAmount(tx), BigDecimal::add);
        }
        return byCategory.entrySet().stream()
                .sorted(Map.Entry.<TransactionCategory, BigDecimal>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<TransactionCategory, BigDecimal>comparingByKey()))
                .map(entry -> CategoryBreakdownDTO.builder()
                        .category(entry.getKey())
                        .amount(entry.getValue())
                        .percentage(entry.getValue()
                                .multiply(HUNDRED)
                                .divide(totalSpent, 2, RoundingMode.DOWN))
                        .build())
                .toList();
    }

    /**
     * Trend over the configured number of months ({@code ledgerly.chatbot.trend-months}).
     */
    public List<MonthlyPointDTO> monthlyTrend(UUID userId) {
        return monthlyTrend(userId, properties.trendMonths());
    }

    /**
     * One point per calendar month, oldest first, ending with the current month. Months without
     * transactions are reported with zeros.
     */
    public List<MonthlyPointDTO> monthlyTrend(UUID userId, int months) {
        if (months <= 0) {
            throw new IllegalArgumentException("months must be positive");
        }
        YearMonth current = YearMonth.from(today());
        YearMonth first = current.minusMonths(months - 1L);

        List<LedgerTransaction> txs = transactionRepository.findByAccountUserIdAndTransactionDateBetween(
                userId, first.atDay(1), current.atEndOfMonth());

        Map<YearMonth, List<LedgerTransaction>> grouped = txs.stream()
                .filter(tx -> tx.getTransactionDate() != null)
                .collect(Collectors.groupingBy(tx -> YearMonth.from(tx.getTransactionDate())));

        List<MonthlyPointDTO> points = new ArrayList<>(months);
        for (int i = months - 1; i >= 0; i--) {
            YearMonth ym = current.minusMonths(i);
            List<LedgerTransaction> monthTx = grouped.getOrDefault(ym, Collections.emptyList());
            BigDecimal income = sumByType(monthTx, TransactionType.INCOME);
            BigDecimal expenses = sumByType(monthTx, TransactionType.EXPENSE);
            points.add(MonthlyPointDTO.builder()
                    .month(ym.format(MONTH_LABEL))
                    .income(income)
                    .expenses(expenses)
                    .net(income.subtract(expenses))
                    .build());
        }
        return points;
    }

    public CashFlowDTO cashFlow(UUID userId, DateWindow window) {
        List<LedgerTransaction> txs = transactionRepository.findByAccountUserIdAndTransactionDateBetween(
                userId, window.from(), window.to());
        BigDecimal income = sumByType(txs, TransactionType.INCOME);
        BigDecimal expenses = sumByType(txs, TransactionType.EXPENSE);
        return CashFlowDTO.builder()
                .from(window.from())
                .to(window.to())
                .income(income)
                .expenses(expenses)
                .net(income.subtract(expenses))
                .build();
    }

    public BigDecimal netFlow(UUID userId, DateWindow window) {
        return cashFlow(userId, window).getNet();
    }

    /**
     * Splits a positive net flow using the configured ratios. Empty when there is nothing to split.
     */
    public Optional<SavingsAllocationDTO> savingsAllocation(BigDecimal net) {
        if (net == null || net.signum() <= 0) {
            return Optional.empty();
        }
        ChatbotProperties.SavingsSplit split = properties.savingsSplit();
        return Optional.of(SavingsAllocationDTO.builder()
                .emergencyFund(net.multiply(split.emergency()).setScale(2, RoundingMode.HALF_UP))
                .longTerm(net.multiply(split.longTerm()).setScale(2, RoundingMode.HALF_UP))
                .discretionary(net.multiply(split.discretionary()).setScale(2, RoundingMode.HALF_UP))
                .build());
    }

    /**
     * Most recent transactions whose amount lies within {@code tolerance} of any of the given
     * amounts, newest first. Without amounts, simply the most recent transactions.
     */
    public List<LedgerTransaction> searchTransactions(UUID userId, List<BigDecimal> amounts, BigDecimal tolerance, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        PageRequest page = PageRequest.of(0, limit);
        if (amounts == null || amounts.isEmpty()) {
            return transactionRepository.findByAccountUserIdOrderByTransactionDateDescCreatedAtDesc(userId, page);
        }

        Map<UUID, LedgerTransaction> merged = new LinkedHashMap<>();
        for (BigDecimal amount : amounts) {
            if (amount == null) {
                continue;
            }
            BigDecimal lower = amount.multiply(BigDecimal.ONE.subtract(tolerance));
            BigDecimal upper = amount.multiply(BigDecimal.ONE.add(tolerance));
            for (LedgerTransaction tx : transactionRepository
                    .findByAccountUserIdAndAmountBetweenOrderByTransactionDateDescCreatedAtDesc(userId, lower, upper, page)) {
                merged.putIfAbsent(tx.getId(), tx);
            }
        }

        return merged.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    /**
     * Recurring expenses paid during the last month, projected one month forward and kept when the
     * projected due date falls within the next {@code horizonDays}. Repeated payments of the same
     * bill collapse into the latest one.
     */
    public List<UpcomingBillDTO> upcomingBills(UUID userId, int horizonDays) {
        LocalDate today = today();
        LocalDate horizon = today.plusDays(horizonDays);
        LocalDate from = today.minusMonths(1);
        LocalDate to = horizon.minusMonths(1);
        if (to.isBefore(from)) {
            return List.of();
        }

        List<LedgerTransaction> recurring = transactionRepository
                .findByAccountUserIdAndTypeAndRecurringTrueAndTransactionDateBetween(userId, TransactionType.EXPENSE, from, to);

        Map<String, LedgerTransaction> latestByBill = new LinkedHashMap<>();
        recurring.stream()
                .filter(tx -> tx.getTransactionDate() != null)
                .sorted(NEWEST_FIRST)
                .forEach(tx -> latestByBill.putIfAbsent(billKey(tx), tx));

        return latestByBill.values().stream()
                .map(tx -> {
                    LocalDate due = tx.getTransactionDate().plusMonths(1);
                    return UpcomingBillDTO.builder()
                            .description(tx.getDescription())
                            .merchantName(tx.getMerchantName())
                            .category(tx.getCategory())
                            .amount(safeAmount(tx))
                            .lastPaidOn(tx.getTransactionDate())
                            .dueDate(due)
                            .daysUntilDue(ChronoUnit.DAYS.between(today, due))
                            .build();
                })
                .filter(bill -> !bill.getDueDate().isBefore(today) && !bill.getDueDate().isAfter(horizon))
                .sorted(Comparator.comparing(UpcomingBillDTO::getDueDate)
                        .thenComparing(UpcomingBillDTO::getAmount, Comparator.reverseOrder()))
                .toList();
    }

    private static String billKey(LedgerTransaction tx) {
        String description = tx.getDescription() != null ? tx.getDescription().trim().toLowerCase(Locale.ROOT) : "";
        String merchant = tx.getMerchantName() != null ? tx.getMerchantName().trim().toLowerCase(Locale.ROOT) : "";
        return description + "|" + merchant;
    }

    private static BigDecimal safeAmount(LedgerTransaction tx) {
        return tx == null || tx.getAmount() == null ? ZERO : tx.getAmount();
    }

    private static BigDecimal sumByType(List<LedgerTransaction> txs, TransactionType type) {
        return txs.stream()
                .filter(Objects::nonNull)
                .filter(tx -> tx.getType() == type)
                .map(LedgerAggregator::safeAmount)
                .reduce(ZERO, BigDecimal::add);
    }
}
