package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;

import com.ledgerly.backend.enums.TransactionCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryBreakdownDTO {

    private TransactionCategory category;
    private BigDecimal amount;
    private BigDecimal percentage;
}
