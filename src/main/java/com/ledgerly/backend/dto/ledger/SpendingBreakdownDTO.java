package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpendingBreakdownDTO {

    private LocalDate from;
    private LocalDate to;
    private BigDecimal total;

    // Every expense category in the window, largest first.
    private List<CategoryBreakdownDTO> categories;

    public List<CategoryBreakdownDTO> top(int n) {
        if (!hasCategories() || n <= 0) {
            return List.of();
        }
        return categories.stream().limit(n).toList();
    }

    public boolean hasCategories() {
        return categories != null && !categories.isEmpty();
    }
}
