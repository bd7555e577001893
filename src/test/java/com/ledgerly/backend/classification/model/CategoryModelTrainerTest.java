package com.ledgerly.backend.classification.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.ledgerly.backend.classification.rules.BootstrapTrainingData;
import com.ledgerly.backend.config.CategorizerProperties;
import com.ledgerly.backend.enums.TransactionCategory;

class CategoryModelTrainerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final CategoryModelTrainer trainer = new CategoryModelTrainer(
            CategorizerProperties.withModelPath("unused.json"), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void train_emptySamples_usesBootstrapDataAndRecordsMetadata() {
        CategoryModel model = trainer.train(List.of());

        assertEquals(NOW, model.trainedAt());
        assertEquals(List.of("bills_utilities", "entertainment", "food_dining", "freelance", "healthcare",
                "salary", "shopping", "transportation"), model.classLabels());
        assertNotNull(model.holdoutAccuracy());
        assertTrue(model.holdoutAccuracy() >= 0.0 && model.holdoutAccuracy() <= 1.0);
        assertTrue(model.vectorizer().size() > 0);
    }

    @Test
    void train_sameSamples_producesSamePredictions() {
        CategoryModel first = trainer.train(BootstrapTrainingData.samples());
        CategoryModel second = trainer.train(BootstrapTrainingData.samples());

        assertEquals(first.vectorizer().vocabulary(), second.vectorizer().vocabulary());
        assertEquals(first.holdoutAccuracy(), second.holdoutAccuracy());
        assertEquals(first.predict("target store", 56.78), second.predict("target store", 56.78));
    }

    @Test
    void stratifiedSplit_takesFloorOfFractionPerCategory() {
        List<TrainingSample> data = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            data.add(new TrainingSample("coffee " + i, null, BigDecimal.ONE, TransactionCategory.FOOD_DINING));
        }
        for (int i = 0; i < 4; i++) {
            data.add(new TrainingSample("uber " + i, null, BigDecimal.ONE, TransactionCategory.TRANSPORTATION));
        }
        data.add(new TrainingSample("salary", null, BigDecimal.TEN, TransactionCategory.SALARY));

        CategoryModelTrainer.Split split = CategoryModelTrainer.stratifiedSplit(data, 0.2, 42);

        // floor(10 * 0.2) + floor(4 * 0.2) + floor(1 * 0.2)
        assertEquals(2, split.test().size());
        assertEquals(13, split.train().size());
        assertTrue(split.test().stream().allMatch(i -> data.get(i).category() == TransactionCategory.FOOD_DINING));

        Set<Integer> all = new HashSet<>(split.train());
        all.addAll(split.test());
        assertEquals(data.size(), all.size());
    }

    @Test
    void stratifiedSplit_sameSeed_isStable() {
        List<TrainingSample> data = BootstrapTrainingData.samples();

        assertEquals(CategoryModelTrainer.stratifiedSplit(data, 0.2, 7),
                CategoryModelTrainer.stratifiedSplit(data, 0.2, 7));
    }

    @Test
    void train_zeroHoldout_skipsEvaluation() {
        CategoryModelTrainer noHoldout = new CategoryModelTrainer(
                new CategorizerProperties("unused.json", null, 10, null, null, 0.0, null),
                Clock.fixed(NOW, ZoneOffset.UTC));

        CategoryModel model = noHoldout.train(BootstrapTrainingData.samples());

        assertEquals(null, model.holdoutAccuracy());
    }
}
