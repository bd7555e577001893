package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;
import java.util.UUID;

import com.ledgerly.backend.enums.AccountKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountBalanceDTO {

    private UUID id;
    private String name;
    private BigDecimal currentBalance;
    private AccountKind kind;
}
