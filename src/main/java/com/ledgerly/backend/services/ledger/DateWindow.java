package com.ledgerly.backend.services.ledger;

import java.time.LocalDate;

/**
 * Inclusive date range over transaction dates.
 */
public record DateWindow(LocalDate from, LocalDate to) {

    public DateWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
    }

    /**
     * The last {@code days} calendar days, today included: {@code lastDays(today, 1)} is today only.
     */
    public static DateWindow lastDays(LocalDate today, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        return new DateWindow(today.minusDays(days - 1L), today);
    }
}
