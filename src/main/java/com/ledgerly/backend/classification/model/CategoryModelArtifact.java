package com.ledgerly.backend.classification.model;

import java.util.List;

/**
 * On-disk form of a {@link CategoryModel}. Field names are part of the file format.
 */
public record CategoryModelArtifact(
        int schemaVersion,
        String trainedAt,
        Double holdoutAccuracy,
        List<String> classLabels,
        VectorizerState vectorizer,
        ClassifierState classifier
) {

    public record VectorizerState(int ngramMin, int ngramMax, List<String> vocabulary, List<Double> idf) {}

    /**
     * The Weka classifier followed by its training header, Java-serialized and base64 encoded.
     */
    public record ClassifierState(String algorithm, String encoding, String payload) {}
}
