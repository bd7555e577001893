package com.ledgerly.backend.services.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;

class DateWindowTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 15);

    @Test
    void lastDays_spansExactlyThatManyCalendarDays() {
        DateWindow window = DateWindow.lastDays(TODAY, 30);

        assertEquals(LocalDate.of(2024, 4, 16), window.from());
        assertEquals(TODAY, window.to());
        assertEquals(30, ChronoUnit.DAYS.between(window.from(), window.to()) + 1);
    }

    @Test
    void lastDays_oneDay_isTodayOnly() {
        DateWindow window = DateWindow.lastDays(TODAY, 1);

        assertEquals(TODAY, window.from());
        assertEquals(TODAY, window.to());
    }

    @Test
    void lastDays_nonPositive_throws() {
        assertThrows(IllegalArgumentException.class, () -> DateWindow.lastDays(TODAY, 0));
    }

    @Test
    void constructor_fromAfterTo_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> new DateWindow(TODAY.plusDays(1), TODAY));
    }
}
