package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceSummaryDTO {

    private List<AccountBalanceDTO> accounts;

    // Credit card balances are left out of the total.
    private BigDecimal total;
}
