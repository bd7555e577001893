package com.ledgerly.backend.dto.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;

/**
 * Criteria for listing a user's transactions. Every field but {@code userId} is optional.
 */
public record TransactionFilterDTO(
        UUID userId,
        UUID accountId,
        TransactionType type,
        TransactionCategory category,
        BigDecimal minAmount,
        BigDecimal maxAmount,
        LocalDate startDate,
        LocalDate endDate,
        String merchant,
        Boolean pending
) {

    public static TransactionFilterDTO forUser(UUID userId) {
        return new TransactionFilterDTO(userId, null, null, null, null, null, null, null, null, null);
    }
}
