package com.ledgerly.backend.dto.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Category is optional; when absent the transaction is categorized automatically.
 */
public record TransactionRequestDTO(

        @NotBlank(message = "accountId is required")
        String accountId,

        @NotBlank(message = "Description is required")
        @Size(max = 500, message = "Description must be at most 500 characters")
        String description,

        @Size(max = 255, message = "Merchant name must be at most 255 characters")
        String merchantName,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than zero")
        BigDecimal amount,

        @NotNull(message = "Type is required")
        TransactionType type,

        TransactionCategory category,

        @Size(max = 100, message = "Subcategory must be at most 100 characters")
        String subcategory,

        @NotNull(message = "Transaction date is required")
        LocalDate transactionDate,

        Boolean recurring,

        Boolean pending
) {}
