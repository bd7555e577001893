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
public class SavingsAllocationDTO {

    private BigDecimal emergencyFund;
    private BigDecimal longTerm;
    private BigDecimal discretionary;
}
