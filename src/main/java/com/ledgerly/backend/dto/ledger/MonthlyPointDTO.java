package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyPointDTO {

    // Format: "2025-01"
    private String month;

    private BigDecimal income;
    private BigDecimal expenses;
    private BigDecimal net;
}
