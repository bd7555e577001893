package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Totals over an optional date range. {@code from}/{@code to} are null when the range is open;
 * the monthly trend always covers the configured trailing months.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionSummaryDTO {

    private LocalDate from;
    private LocalDate to;
    private BigDecimal totalIncome;
    private BigDecimal totalExpenses;
    private BigDecimal netIncome;
    private long transactionCount;
    private List<CategoryBreakdownDTO> topCategories;
    private List<MonthlyPointDTO> monthlyTrend;
}
