package com.ledgerly.backend.chatbot.entities;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Purpose-built facts pulled from a chat message. Categories keep vocabulary order.
 */
public record StructuredEntities(List<BigDecimal> amounts, List<String> dates, Set<String> categories) {

    public StructuredEntities {
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
        dates = dates == null ? List.of() : List.copyOf(dates);
        categories = categories == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(categories));
    }

    public static StructuredEntities empty() {
        return new StructuredEntities(List.of(), List.of(), Set.of());
    }

    public boolean hasAmounts() {
        return !amounts.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<BigDecimal> amounts = new ArrayList<>();
        private final List<String> dates = new ArrayList<>();
        private final Set<String> categories = new LinkedHashSet<>();

        private Builder() {}

        public Builder amount(BigDecimal amount) {
            if (amount != null) amounts.add(amount);
            return this;
        }

        public Builder date(String date) {
            if (date != null && !date.isBlank()) dates.add(date);
            return this;
        }

        public Builder category(String category) {
            if (category != null && !category.isBlank()) categories.add(category);
            return this;
        }

        public StructuredEntities build() {
            return new StructuredEntities(amounts, dates, categories);
        }
    }
}
