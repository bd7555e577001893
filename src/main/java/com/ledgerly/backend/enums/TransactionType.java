package com.ledgerly.backend.enums;

public enum TransactionType {
    INCOME,
    EXPENSE,
    TRANSFER
}
