package com.ledgerly.backend.seed;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.classification.CategoryModelTrainingService;
import com.ledgerly.backend.classification.TransactionCategorizer;
import com.ledgerly.backend.classification.model.CategoryModel;
import com.ledgerly.backend.classification.model.CategoryModelStore;
import com.ledgerly.backend.exceptions.CategoryModelException;

/**
 * Publishes a categorizer model before the first request: the persisted artifact when it loads,
 * otherwise a fresh model trained on the bootstrap dataset.
 */
@Component
@ConditionalOnProperty(name = "ledgerly.categorizer.bootstrap-on-startup", havingValue = "true", matchIfMissing = true)
public class CategoryModelBootstrapRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(CategoryModelBootstrapRunner.class);

    private final CategoryModelStore store;
    private final TransactionCategorizer categorizer;
    private final CategoryModelTrainingService trainingService;

    public CategoryModelBootstrapRunner(
            CategoryModelStore store,
            TransactionCategorizer categorizer,
            CategoryModelTrainingService trainingService
    ) {
        this.store = store;
        this.categorizer = categorizer;
        this.trainingService = trainingService;
    }

    @Override
    public void run(ApplicationArguments args) {
        Optional<CategoryModel> loaded;
        try {
            loaded = store.load();
        } catch (CategoryModelException e) {
            logger.warn("[Seed] Categorizer artifact at {} is unusable ({}). Retraining.", store.path(), e.getMessage());
            loaded = Optional.empty();
        }

        if (loaded.isPresent()) {
            categorizer.publish(loaded.get());
            logger.info("[Seed] Categorizer loaded from {}", store.path());
            return;
        }

        var report = trainingService.trainAndPublish(List.of());
        logger.info("[Seed] Categorizer trained on bootstrap data: {} samples, holdoutAccuracy={}",
                report.sampleCount(), report.holdoutAccuracy());
    }
}
