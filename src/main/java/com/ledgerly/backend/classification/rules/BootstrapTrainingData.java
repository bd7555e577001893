package com.ledgerly.backend.classification.rules;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.ledgerly.backend.classification.model.TrainingSample;
import com.ledgerly.backend.enums.TransactionCategory;

/**
 * Seed dataset used when the categorizer is trained without ledger samples.
 */
public final class BootstrapTrainingData {

    static final int REPETITIONS = 10;

    private static final List<TrainingSample> BASE = List.of(
            // Food & dining
            sample("MCDONALD'S #123", "McDonald's", "8.50", TransactionCategory.FOOD_DINING),
            sample("STARBUCKS COFFEE", "Starbucks", "5.25", TransactionCategory.FOOD_DINING),
            sample("WHOLE FOODS MARKET", "Whole Foods", "67.89", TransactionCategory.FOOD_DINING),
            sample("RESTAURANT PAYMENT", "Local Bistro", "45.00", TransactionCategory.FOOD_DINING),

            // Shopping
            sample("AMAZON PURCHASE", "Amazon", "29.99", TransactionCategory.SHOPPING),
            sample("TARGET STORE", "Target", "56.78", TransactionCategory.SHOPPING),
            sample("APPLE STORE ONLINE", "Apple", "199.00", TransactionCategory.SHOPPING),

            // Transportation
            sample("SHELL GAS STATION", "Shell", "35.00", TransactionCategory.TRANSPORTATION),
            sample("UBER RIDE", "Uber", "12.50", TransactionCategory.TRANSPORTATION),
            sample("METRO TRANSIT", "Metro", "2.75", TransactionCategory.TRANSPORTATION),

            // Bills & utilities
            sample("ELECTRIC BILL PAYMENT", "Electric Company", "89.45", TransactionCategory.BILLS_UTILITIES),
            sample("INTERNET SERVICE", "Comcast", "79.99", TransactionCategory.BILLS_UTILITIES),
            sample("PHONE BILL", "Verizon", "65.00", TransactionCategory.BILLS_UTILITIES),

            // Entertainment
            sample("NETFLIX SUBSCRIPTION", "Netflix", "15.99", TransactionCategory.ENTERTAINMENT),
            sample("MOVIE THEATER", "AMC", "24.00", TransactionCategory.ENTERTAINMENT),
            sample("SPOTIFY PREMIUM", "Spotify", "9.99", TransactionCategory.ENTERTAINMENT),

            // Healthcare
            sample("PHARMACY PRESCRIPTION", "CVS", "25.50", TransactionCategory.HEALTHCARE),
            sample("DOCTOR VISIT COPAY", "Medical Center", "30.00", TransactionCategory.HEALTHCARE),

            // Income
            sample("SALARY DEPOSIT", "Employer", "3500.00", TransactionCategory.SALARY),
            sample("FREELANCE PAYMENT", "Client", "500.00", TransactionCategory.FREELANCE)
    );

    private static final List<TrainingSample> SAMPLES;

    static {
        List<TrainingSample> all = new ArrayList<>(BASE.size() * REPETITIONS);
        for (int i = 0; i < REPETITIONS; i++) {
            all.addAll(BASE);
        }
        SAMPLES = Collections.unmodifiableList(all);
    }

    private BootstrapTrainingData() {}

    public static List<TrainingSample> samples() {
        return SAMPLES;
    }

    private static TrainingSample sample(String description, String merchant, String amount, TransactionCategory category) {
        return new TrainingSample(description, merchant, new BigDecimal(amount), category);
    }
}
