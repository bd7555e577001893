package com.ledgerly.backend.classification.model;

import java.math.BigDecimal;

import com.ledgerly.backend.enums.TransactionCategory;

public record TrainingSample(String description, String merchantName, BigDecimal amount, TransactionCategory category) {
    public TrainingSample {
        if (description == null) throw new IllegalArgumentException("description is required");
        if (amount == null) throw new IllegalArgumentException("amount is required");
        if (category == null) throw new IllegalArgumentException("category is required");
    }
}
