package com.ledgerly.backend.dto.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;

public record TransactionResponseDTO(
        String id,
        String accountId,
        String description,
        String merchantName,
        BigDecimal amount,
        TransactionType type,
        TransactionCategory category,
        String subcategory,
        BigDecimal confidenceScore,
        boolean recurring,
        boolean pending,
        LocalDate transactionDate,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
