package com.ledgerly.backend.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionCategory {
    // Income
    SALARY("salary"),
    FREELANCE("freelance"),
    INVESTMENT_INCOME("investment_income"),
    OTHER_INCOME("other_income"),

    // Expense
    FOOD_DINING("food_dining"),
    SHOPPING("shopping"),
    TRANSPORTATION("transportation"),
    ENTERTAINMENT("entertainment"),
    BILLS_UTILITIES("bills_utilities"),
    HEALTHCARE("healthcare"),
    EDUCATION("education"),
    TRAVEL("travel"),
    INSURANCE("insurance"),
    TAXES("taxes"),
    OTHER_EXPENSE("other_expense"),

    // Transfer
    TRANSFER_IN("transfer_in"),
    TRANSFER_OUT("transfer_out");

    private final String value;

    TransactionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * "food_dining" -> "Food Dining".
     */
    public String displayName() {
        String[] parts = value.split("_");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    public static Optional<TransactionCategory> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.value.equals(key) || c.name().equalsIgnoreCase(key))
                .findFirst();
    }

    @JsonCreator
    public static TransactionCategory fromJson(String raw) {
        return fromValue(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction category: " + raw));
    }
}
