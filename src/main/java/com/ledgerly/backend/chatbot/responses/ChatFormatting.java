package com.ledgerly.backend.chatbot.responses;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class ChatFormatting {

    public static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MM/dd");

    private ChatFormatting() {
    }

    /**
     * "$1,234.50"; negative amounts as "$-80.00".
     */
    public static String formatCurrency(BigDecimal amount) {
        BigDecimal safe = amount != null ? amount : BigDecimal.ZERO;
        return "$" + decimalFormat("#,##0.00").format(safe.setScale(2, RoundingMode.HALF_UP));
    }

    /**
     * One decimal, truncated: 33.33 -> "33.3%".
     */
    public static String formatPercent(BigDecimal percentage) {
        BigDecimal safe = percentage != null ? percentage : BigDecimal.ZERO;
        return safe.setScale(1, RoundingMode.DOWN).toPlainString() + "%";
    }

    // DecimalFormat is not thread-safe.
    private static DecimalFormat decimalFormat(String pattern) {
        DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format;
    }
}
