package com.ledgerly.backend.classification;

import com.ledgerly.backend.enums.TransactionCategory;

/**
 * @param subcategory null when no keyword rule matched
 * @param confidence  in [0, 1]
 */
public record CategorizationResult(TransactionCategory category, String subcategory, double confidence) {

    static final double UNTRAINED_CONFIDENCE = 0.1;

    public static CategorizationResult untrained() {
        return new CategorizationResult(TransactionCategory.OTHER_EXPENSE, null, UNTRAINED_CONFIDENCE);
    }
}
