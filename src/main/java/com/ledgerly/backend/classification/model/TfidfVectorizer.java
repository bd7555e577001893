package com.ledgerly.backend.classification.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bag of unigrams and bigrams weighted by TF-IDF.
 *
 * <ul>
 *   <li>tokens are runs of two or more word characters, English stop words removed</li>
 *   <li>bigrams are built from adjacent kept tokens</li>
 *   <li>the vocabulary keeps the {@code maxFeatures} most frequent terms over the corpus
 *       (ties by term), indexed alphabetically</li>
 *   <li>idf = ln((1 + n) / (1 + df)) + 1; rows are L2-normalized</li>
 * </ul>
 *
 * Instances are immutable and safe to share between threads.
 */
public final class TfidfVectorizer {

    public static final int NGRAM_MIN = 1;
    public static final int NGRAM_MAX = 2;

    private static final Pattern TOKEN = Pattern.compile("(?U)\\b\\w\\w+\\b");

    private final List<String> vocabulary;
    private final Map<String, Integer> index;
    private final double[] idf;

    private TfidfVectorizer(List<String> vocabulary, double[] idf) {
        if (vocabulary.size() != idf.length) {
            throw new IllegalArgumentException("vocabulary and idf sizes differ: "
                    + vocabulary.size() + " != " + idf.length);
        }
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < vocabulary.size(); i++) {
            if (idx.put(vocabulary.get(i), i) != null) {
                throw new IllegalArgumentException("duplicate vocabulary term: " + vocabulary.get(i));
            }
        }
        this.vocabulary = List.copyOf(vocabulary);
        this.index = Collections.unmodifiableMap(idx);
        this.idf = idf.clone();
    }

    public static TfidfVectorizer fit(List<String> documents, int maxFeatures) {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("cannot fit a vectorizer on an empty corpus");
        }

        Map<String, Integer> termFrequency = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String doc : documents) {
            List<String> terms = analyze(doc);
            for (String term : terms) {
                termFrequency.merge(term, 1, Integer::sum);
            }
            for (String term : new HashSet<>(terms)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        List<String> selected = termFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(maxFeatures)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();

        int n = documents.size();
        double[] idf = new double[selected.size()];
        for (int i = 0; i < selected.size(); i++) {
            int df = documentFrequency.getOrDefault(selected.get(i), 0);
            idf[i] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        }
        return new TfidfVectorizer(selected, idf);
    }

    /**
     * Rebuilds a fitted vectorizer from persisted state.
     */
    public static TfidfVectorizer restore(List<String> vocabulary, double[] idf) {
        return new TfidfVectorizer(vocabulary, idf);
    }

    public SparseVector transform(String document) {
        Map<Integer, Double> counts = new TreeMap<>();
        for (String term : analyze(document)) {
            Integer i = index.get(term);
            if (i != null) {
                counts.merge(i, 1.0, Double::sum);
            }
        }

        int[] indices = new int[counts.size()];
        double[] values = new double[counts.size()];
        double norm = 0.0;
        int k = 0;
        for (Map.Entry<Integer, Double> e : counts.entrySet()) {
            indices[k] = e.getKey();
            values[k] = e.getValue() * idf[e.getKey()];
            norm += values[k] * values[k];
            k++;
        }
        if (norm > 0.0) {
            double len = Math.sqrt(norm);
            for (int j = 0; j < values.length; j++) {
                values[j] /= len;
            }
        }
        return new SparseVector(indices, values);
    }

    public int size() {
        return vocabulary.size();
    }

    public List<String> vocabulary() {
        return vocabulary;
    }

    public double[] idf() {
        return idf.clone();
    }

    static List<String> analyze(String document) {
        if (document == null || document.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(document);
        while (m.find()) {
            String token = m.group();
            if (!EnglishStopWords.WORDS.contains(token)) {
                tokens.add(token);
            }
        }

        List<String> terms = new ArrayList<>(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }

    @Override
    public String toString() {
        return "TfidfVectorizer{terms=" + vocabulary.size() + "}";
    }
}
