package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashFlowDTO {

    private LocalDate from;
    private LocalDate to;
    private BigDecimal income;
    private BigDecimal expenses;
    private BigDecimal net;
}
