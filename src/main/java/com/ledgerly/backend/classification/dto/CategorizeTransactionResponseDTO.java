package com.ledgerly.backend.classification.dto;

import com.ledgerly.backend.enums.TransactionCategory;

public record CategorizeTransactionResponseDTO(
        TransactionCategory category,
        String subcategory,
        double confidenceScore
) {}
