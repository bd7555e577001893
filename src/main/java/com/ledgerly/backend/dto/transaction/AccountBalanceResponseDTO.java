package com.ledgerly.backend.dto.transaction;

import java.math.BigDecimal;

public record AccountBalanceResponseDTO(
        String accountId,
        BigDecimal currentBalance
) {}
