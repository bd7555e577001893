package com.ledgerly.backend.classification.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.ledgerly.backend.enums.TransactionCategory;

public final class SubcategoryRules {

    private SubcategoryRules() {}

    /**
     * Structure: category -> (subcategory -> keywords).
     * Iteration order is the match order; the first subcategory with any keyword hit wins.
     * Keywords are lowercase.
     */
    public static final Map<TransactionCategory, Map<String, List<String>>> RULES;

    static {
        Map<TransactionCategory, Map<String, List<String>>> rules = new LinkedHashMap<>();

        Map<String, List<String>> food = new LinkedHashMap<>();
        food.put("restaurant", List.of("restaurant", "cafe", "bistro", "grill"));
        food.put("fast_food", List.of("mcdonalds", "burger", "pizza", "subway"));
        food.put("grocery", List.of("grocery", "supermarket", "walmart", "target"));
        food.put("coffee", List.of("starbucks", "coffee", "dunkin"));
        rules.put(TransactionCategory.FOOD_DINING, Collections.unmodifiableMap(food));

        Map<String, List<String>> shopping = new LinkedHashMap<>();
        shopping.put("clothing", List.of("clothing", "apparel", "fashion", "shoes"));
        shopping.put("electronics", List.of("electronics", "apple", "best buy", "amazon"));
        shopping.put("household", List.of("home", "furniture", "kitchen", "bath"));
        rules.put(TransactionCategory.SHOPPING, Collections.unmodifiableMap(shopping));

        Map<String, List<String>> transportation = new LinkedHashMap<>();
        transportation.put("gas", List.of("gas", "fuel", "exxon", "shell", "bp"));
        transportation.put("public_transit", List.of("metro", "bus", "train", "uber", "lyft"));
        transportation.put("parking", List.of("parking", "toll"));
        rules.put(TransactionCategory.TRANSPORTATION, Collections.unmodifiableMap(transportation));

        RULES = Collections.unmodifiableMap(rules);
    }

    /**
     * Matches against the raw description and merchant (lowercased, not preprocessed), so
     * multi-word keywords such as "best buy" still hit.
     */
    public static Optional<String> resolve(TransactionCategory category, String description, String merchantName) {
        Map<String, List<String>> subcategories = RULES.get(category);
        if (subcategories == null) {
            return Optional.empty();
        }

        String text = ((description == null ? "" : description) + " "
                + (merchantName == null ? "" : merchantName)).toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> entry : subcategories.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (text.contains(keyword)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }
}
