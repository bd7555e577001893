package com.ledgerly.backend.classification.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TfidfVectorizerTest {

    private static final List<String> CORPUS = List.of("coffee shop", "coffee beans", "gas station");

    @Test
    void fit_buildsAlphabeticalVocabularyOfUnigramsAndBigrams() {
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(CORPUS, 100);

        assertEquals(List.of("beans", "coffee", "coffee beans", "coffee shop", "gas", "gas station", "shop", "station"),
                vectorizer.vocabulary());
    }

    @Test
    void fit_usesSmoothedIdf() {
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(CORPUS, 100);
        int coffee = vectorizer.vocabulary().indexOf("coffee");
        int gas = vectorizer.vocabulary().indexOf("gas");

        assertEquals(Math.log(4.0 / 3.0) + 1.0, vectorizer.idf()[coffee], 1e-12);
        assertEquals(Math.log(4.0 / 2.0) + 1.0, vectorizer.idf()[gas], 1e-12);
    }

    @Test
    void fit_maxFeatures_keepsMostFrequentTermsWithTiesByTerm() {
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(CORPUS, 3);

        assertEquals(List.of("beans", "coffee", "coffee beans"), vectorizer.vocabulary());
    }

    @Test
    void fit_dropsStopWordsAndSingleCharacterTokens() {
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(List.of("the a coffee x"), 100);

        assertEquals(List.of("coffee"), vectorizer.vocabulary());
    }

    @Test
    void fit_emptyCorpus_throws() {
        assertThrows(IllegalArgumentException.class, () -> TfidfVectorizer.fit(List.of(), 10));
    }

    @Test
    void transform_rowIsL2Normalized() {
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(CORPUS, 100);

        SparseVector row = vectorizer.transform("coffee shop coffee");

        double norm = 0.0;
        for (double v : row.values()) {
            norm += v * v;
        }
        assertEquals(1.0, Math.sqrt(norm), 1e-9);
        assertEquals(3, row.nonZeroCount());
        for (int i = 1; i < row.indices().length; i++) {
            assertTrue(row.indices()[i - 1] < row.indices()[i]);
        }
    }

    @Test
    void transform_unknownWords_returnsEmptyVector() {
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(CORPUS, 100);

        SparseVector row = vectorizer.transform("netflix subscription");

        assertEquals(0, row.nonZeroCount());
        assertEquals(0, vectorizer.transform("").nonZeroCount());
    }

    @Test
    void restore_reproducesFittedTransform() {
        TfidfVectorizer fitted = TfidfVectorizer.fit(CORPUS, 100);
        TfidfVectorizer restored = TfidfVectorizer.restore(fitted.vocabulary(), fitted.idf());

        SparseVector expected = fitted.transform("coffee station");
        SparseVector actual = restored.transform("coffee station");

        assertArrayEquals(expected.indices(), actual.indices());
        assertArrayEquals(expected.values(), actual.values(), 0.0);
    }

    @Test
    void restore_mismatchedSizes_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> TfidfVectorizer.restore(List.of("coffee", "gas"), new double[] {1.0}));
    }
}
