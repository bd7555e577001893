package com.ledgerly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Training parameters and artifact location for the transaction categorizer.
 * Loaded from "ledgerly.categorizer.*".
 */
@ConfigurationProperties(prefix = "ledgerly.categorizer")
public record CategorizerProperties(
        String modelPath,
        Integer maxFeatures,
        Integer numTrees,
        Integer maxDepth,
        Integer seed,
        Double holdoutFraction,
        Integer minLedgerSamples
) {
    public CategorizerProperties {
        if (modelPath == null || modelPath.isBlank()) {
            modelPath = "data/categorizer-model.json";
        }
        if (maxFeatures == null || maxFeatures <= 0) {
            maxFeatures = 1000;
        }
        if (numTrees == null || numTrees <= 0) {
            numTrees = 100;
        }
        if (maxDepth == null || maxDepth <= 0) {
            maxDepth = 10;
        }
        if (seed == null) {
            seed = 42;
        }
        if (holdoutFraction == null || holdoutFraction < 0.0 || holdoutFraction >= 1.0) {
            holdoutFraction = 0.2;
        }
        if (minLedgerSamples == null || minLedgerSamples < 0) {
            minLedgerSamples = 50;
        }
    }

    public static CategorizerProperties withModelPath(String modelPath) {
        return new CategorizerProperties(modelPath, null, null, null, null, null, null);
    }
}
