package com.ledgerly.backend.classification.model;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.springframework.stereotype.Component;

import com.ledgerly.backend.classification.TextPreprocessor;
import com.ledgerly.backend.classification.rules.BootstrapTrainingData;
import com.ledgerly.backend.config.CategorizerProperties;
import com.ledgerly.backend.exceptions.CategoryModelException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Evaluation;
import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

/**
 * Fits a {@link CategoryModel} from labelled samples.
 *
 * Deterministic for a given sample list: the vectorizer is fitted on the whole corpus, the
 * holdout split is stratified per category with the configured seed and the forest uses the same
 * seed on a single execution slot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategoryModelTrainer {

    private final CategorizerProperties properties;
    private final Clock clock;

    public CategoryModel train(List<TrainingSample> samples) {
        List<TrainingSample> data = samples == null || samples.isEmpty()
                ? BootstrapTrainingData.samples()
                : samples;

        List<String> documents = new ArrayList<>(data.size());
        for (TrainingSample sample : data) {
            documents.add(TextPreprocessor.preprocess(sample.description(), sample.merchantName()));
        }
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(documents, properties.maxFeatures());

        List<String> labels = data.stream()
                .map(s -> s.category().getValue())
                .distinct()
                .sorted()
                .toList();

        Split split = stratifiedSplit(data, properties.holdoutFraction(), properties.seed());
        Instances train = toInstances(split.train(), documents, vectorizer, labels, data);
        Instances test = toInstances(split.test(), documents, vectorizer, labels, data);

        RandomForest forest = new RandomForest();
        forest.setNumIterations(properties.numTrees());
        forest.setMaxDepth(properties.maxDepth());
        forest.setSeed(properties.seed());
        forest.setNumExecutionSlots(1);

        Double accuracy = null;
        try {
            forest.buildClassifier(train);
            if (test.numInstances() > 0) {
                Evaluation evaluation = new Evaluation(train);
                evaluation.evaluateModel(forest, test);
                accuracy = evaluation.pctCorrect() / 100.0;
                log.info("[CategoryModelTrainer] Holdout evaluation ({} samples):{}",
                        test.numInstances(), evaluation.toSummaryString());
            }
        } catch (Exception e) {
            throw new CategoryModelException("Failed to train categorizer", e);
        }

        log.info("[CategoryModelTrainer] Trained on {} samples, {} terms, {} categories, holdoutAccuracy={}",
                train.numInstances(), vectorizer.size(), labels.size(), accuracy);
        return new CategoryModel(vectorizer, forest, labels, clock.instant(), accuracy);
    }

    private Instances toInstances(List<Integer> rows, List<String> documents, TfidfVectorizer vectorizer,
                                  List<String> labels, List<TrainingSample> data) {
        Instances dataset = CategoryModel.header(vectorizer.size(), labels, rows.size());
        for (int row : rows) {
            TrainingSample sample = data.get(row);
            dataset.add(CategoryModel.toInstance(
                    vectorizer.transform(documents.get(row)),
                    sample.amount().doubleValue(),
                    sample.category().getValue(),
                    dataset));
        }
        return dataset;
    }

    /**
     * Per category, a seeded shuffle followed by taking the first {@code floor(n * fraction)} rows
     * for the holdout. Categories with a single sample stay entirely in training.
     */
    static Split stratifiedSplit(List<TrainingSample> data, double fraction, int seed) {
        Map<String, List<Integer>> byCategory = new LinkedHashMap<>();
        for (int i = 0; i < data.size(); i++) {
            byCategory.computeIfAbsent(data.get(i).category().getValue(), k -> new ArrayList<>()).add(i);
        }

        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        byCategory.keySet().stream().sorted().forEach(category -> {
            List<Integer> rows = new ArrayList<>(byCategory.get(category));
            Collections.shuffle(rows, random);
            int holdout = (int) Math.floor(rows.size() * fraction);
            test.addAll(rows.subList(0, holdout));
            train.addAll(rows.subList(holdout, rows.size()));
        });
        Collections.sort(train);
        Collections.sort(test);
        return new Split(train, test);
    }

    record Split(List<Integer> train, List<Integer> test) {}
}
