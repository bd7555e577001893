package com.ledgerly.backend.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerly.backend.classification.dto.ModelTrainingReportDTO;
import com.ledgerly.backend.classification.model.CategoryModel;
import com.ledgerly.backend.classification.model.CategoryModelStore;
import com.ledgerly.backend.classification.model.CategoryModelTrainer;
import com.ledgerly.backend.classification.model.TrainingSample;
import com.ledgerly.backend.classification.rules.BootstrapTrainingData;
import com.ledgerly.backend.config.CategorizerProperties;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Trains, persists and publishes categorizer models.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryModelTrainingService {

    private final CategoryModelTrainer trainer;
    private final CategoryModelStore store;
    private final TransactionCategorizer categorizer;
    private final LedgerTransactionRepository transactionRepository;
    private final CategorizerProperties properties;

    /**
     * Trains on {@code samples} (the bootstrap set when empty), saves the artifact, then publishes.
     * A failed save is logged and the model is still published for this process.
     */
    public ModelTrainingReportDTO trainAndPublish(List<TrainingSample> samples) {
        CategoryModel model = trainer.train(samples);
        try {
            store.save(model);
        } catch (RuntimeException e) {
            log.warn("[CategoryModelTrainingService] Model trained but not persisted: {}", e.getMessage());
        }
        categorizer.publish(model);
        int sampleCount = samples == null || samples.isEmpty()
                ? BootstrapTrainingData.samples().size()
                : samples.size();
        return new ModelTrainingReportDTO(sampleCount, model.classLabels(), model.vectorizer().size(),
                model.holdoutAccuracy(), model.trainedAt());
    }

    /**
     * Retrains from categorized ledger transactions. Below {@code minLedgerSamples} the ledger rows
     * are appended to the bootstrap set instead of replacing it.
     */
    @Async("categorizerTrainingExecutor")
    @Transactional(readOnly = true)
    public CompletableFuture<ModelTrainingReportDTO> retrainFromLedger() {
        List<TrainingSample> ledgerSamples = transactionRepository.findAll().stream()
                .filter(tx -> tx.getCategory() != null && tx.getDescription() != null && tx.getAmount() != null)
                .map(CategoryModelTrainingService::toSample)
                .toList();

        List<TrainingSample> samples;
        if (ledgerSamples.size() < properties.minLedgerSamples()) {
            log.info("[CategoryModelTrainingService] Only {} labelled ledger rows (min {}), mixing in bootstrap data",
                    ledgerSamples.size(), properties.minLedgerSamples());
            samples = new ArrayList<>(BootstrapTrainingData.samples());
            samples.addAll(ledgerSamples);
        } else {
            samples = ledgerSamples;
        }

        try {
            return CompletableFuture.completedFuture(trainAndPublish(samples));
        } catch (RuntimeException e) {
            log.error("[CategoryModelTrainingService] Retrain failed, keeping current model", e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private static TrainingSample toSample(LedgerTransaction tx) {
        return new TrainingSample(tx.getDescription(), tx.getMerchantName(), tx.getAmount().abs(), tx.getCategory());
    }
}
