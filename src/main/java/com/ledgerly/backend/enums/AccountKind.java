package com.ledgerly.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountKind {
    CHECKING("checking"),
    SAVINGS("savings"),
    CREDIT_CARD("credit_card"),
    INVESTMENT("investment"),
    LOAN("loan");

    private final String value;

    AccountKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Credit balances are liabilities and stay out of the available-funds total.
     */
    public boolean isCredit() {
        return this == CREDIT_CARD;
    }
}
