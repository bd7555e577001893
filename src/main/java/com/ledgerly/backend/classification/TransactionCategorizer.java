package com.ledgerly.backend.classification;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Service;

import com.ledgerly.backend.classification.model.CategoryModel;
import com.ledgerly.backend.classification.rules.SubcategoryRules;
import com.ledgerly.backend.enums.TransactionCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Suggests a category for a transaction from its description, merchant and amount.
 *
 * The model is held in an {@link AtomicReference}; a retrain publishes a fresh instance, and
 * every call reads the reference once, so a prediction never mixes two models.
 */
@Service
@Slf4j
public class TransactionCategorizer {

    private final AtomicReference<CategoryModel> model = new AtomicReference<>();

    public CategorizationResult categorize(String description, BigDecimal amount, String merchantName) {
        CategoryModel current = model.get();
        if (current == null) {
            log.debug("[TransactionCategorizer] No model published, returning default category");
            return CategorizationResult.untrained();
        }

        String text = TextPreprocessor.preprocess(description, merchantName);
        double rawAmount = amount != null ? amount.doubleValue() : 0.0;
        CategoryModel.Prediction prediction = current.predict(text, rawAmount);

        TransactionCategory category = TransactionCategory.fromValue(prediction.label())
                .orElse(TransactionCategory.OTHER_EXPENSE);
        String subcategory = SubcategoryRules.resolve(category, description, merchantName).orElse(null);

        log.debug("[TransactionCategorizer] '{}' -> {} / {} ({})",
                text, category.getValue(), subcategory, prediction.confidence());
        return new CategorizationResult(category, subcategory, prediction.confidence());
    }

    public void publish(CategoryModel newModel) {
        if (newModel == null) {
            throw new IllegalArgumentException("model is required");
        }
        CategoryModel previous = model.getAndSet(newModel);
        log.info("[TransactionCategorizer] Published model trainedAt={} (replaced={})",
                newModel.trainedAt(), previous != null);
    }

    public boolean isTrained() {
        return model.get() != null;
    }

    public Optional<CategoryModel> currentModel() {
        return Optional.ofNullable(model.get());
    }
}
