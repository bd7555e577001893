package com.ledgerly.backend.classification.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.ledgerly.backend.exceptions.CategoryModelException;

import weka.classifiers.Classifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

/**
 * A fitted categorizer: vectorizer state, the Weka classifier and the class labels it predicts.
 *
 * Never mutated after construction. Retraining builds a new instance and the owner swaps the
 * reference, so concurrent {@link #predict} calls need no locking.
 */
public final class CategoryModel {

    public static final int SCHEMA_VERSION = 1;

    static final String AMOUNT_ATTRIBUTE = "amount";
    static final String CLASS_ATTRIBUTE = "category";
    private static final String FEATURE_PREFIX = "tfidf_";

    private final TfidfVectorizer vectorizer;
    private final Classifier classifier;
    private final List<String> classLabels;
    private final Instances header;
    private final Instant trainedAt;
    private final Double holdoutAccuracy;

    public CategoryModel(
            TfidfVectorizer vectorizer,
            Classifier classifier,
            List<String> classLabels,
            Instant trainedAt,
            Double holdoutAccuracy
    ) {
        if (vectorizer == null) throw new IllegalArgumentException("vectorizer is required");
        if (classifier == null) throw new IllegalArgumentException("classifier is required");
        if (classLabels == null || classLabels.isEmpty()) throw new IllegalArgumentException("classLabels is required");
        this.vectorizer = vectorizer;
        this.classifier = classifier;
        this.classLabels = List.copyOf(classLabels);
        this.header = header(vectorizer.size(), this.classLabels, 0);
        this.trainedAt = trainedAt != null ? trainedAt : Instant.now();
        this.holdoutAccuracy = holdoutAccuracy;
    }

    /**
     * Attribute layout shared by training and inference: one numeric attribute per vocabulary
     * term, the raw amount, then the nominal class.
     */
    static Instances header(int featureCount, List<String> classLabels, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(featureCount + 2);
        for (int i = 0; i < featureCount; i++) {
            attributes.add(new Attribute(FEATURE_PREFIX + i));
        }
        attributes.add(new Attribute(AMOUNT_ATTRIBUTE));
        attributes.add(new Attribute(CLASS_ATTRIBUTE, new ArrayList<>(classLabels)));

        Instances dataset = new Instances("transactions", attributes, capacity);
        dataset.setClassIndex(attributes.size() - 1);
        return dataset;
    }

    /**
     * Builds an instance bound to {@code dataset}. A null label leaves the class missing.
     */
    static Instance toInstance(SparseVector features, double amount, String label, Instances dataset) {
        int featureCount = dataset.numAttributes() - 2;
        double[] values = new double[dataset.numAttributes()];
        int[] idx = features.indices();
        double[] vals = features.values();
        for (int i = 0; i < idx.length; i++) {
            if (idx[i] < featureCount) {
                values[idx[i]] = vals[i];
            }
        }
        values[featureCount] = amount;

        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(dataset);
        if (label == null) {
            instance.setClassMissing();
        } else {
            instance.setClassValue(label);
        }
        return instance;
    }

    /**
     * Predicts from already preprocessed text. Ties in the class distribution go to the label
     * listed first.
     */
    public Prediction predict(String preprocessedText, double amount) {
        Instance instance = toInstance(vectorizer.transform(preprocessedText), amount, null, header);
        double[] distribution;
        try {
            distribution = classifier.distributionForInstance(instance);
        } catch (Exception e) {
            throw new CategoryModelException("Classifier failed to score instance", e);
        }

        int best = 0;
        for (int i = 1; i < distribution.length; i++) {
            if (distribution[i] > distribution[best]) {
                best = i;
            }
        }
        double confidence = distribution.length == 0 ? 0.0 : Math.max(0.0, Math.min(1.0, distribution[best]));
        return new Prediction(classLabels.get(best), confidence);
    }

    /**
     * Empty dataset with the attribute layout the classifier was trained on.
     */
    Instances header() {
        return new Instances(header, 0);
    }

    public TfidfVectorizer vectorizer() {
        return vectorizer;
    }

    public Classifier classifier() {
        return classifier;
    }

    public List<String> classLabels() {
        return classLabels;
    }

    public Instant trainedAt() {
        return trainedAt;
    }

    public Double holdoutAccuracy() {
        return holdoutAccuracy;
    }

    public int schemaVersion() {
        return SCHEMA_VERSION;
    }

    public record Prediction(String label, double confidence) {}
}
