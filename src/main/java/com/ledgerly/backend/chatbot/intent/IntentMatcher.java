package com.ledgerly.backend.chatbot.intent;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Lexical intent classifier.
 *
 * <p>Each pattern is scored by the Jaccard overlap of whitespace-separated, lowercased word sets;
 * a pattern that appears verbatim in the message scores at least {@value #SUBSTRING_BOOST}. An
 * intent scores the max over its patterns, and the intent with the strictly largest score wins,
 * so on ties the one listed first in the {@link IntentTable} is kept. Scores below
 * {@value #MIN_CONFIDENCE} resolve to {@code unknown}.
 *
 * <p>Punctuation is not stripped: "balance?" and "balance" are different words here.
 */
@Component
@Slf4j
public class IntentMatcher {

    static final double MIN_CONFIDENCE = 0.3;
    static final double SUBSTRING_BOOST = 0.8;

    private final IntentTable intentTable;

    public IntentMatcher(IntentTable intentTable) {
        this.intentTable = intentTable;
    }

    public IntentMatch classify(String message) {
        String normalized = message == null ? "" : message.toLowerCase(Locale.ROOT);
        Set<String> messageWords = wordsOf(normalized);

        String bestIntent = IntentMatch.UNKNOWN;
        double bestScore = 0.0;

        for (IntentDefinition intent : intentTable.intents()) {
            double score = scoreIntent(normalized, messageWords, intent.patterns());
            if (score > bestScore) {
                bestScore = score;
                bestIntent = intent.name();
            }
        }

        if (bestScore < MIN_CONFIDENCE) {
            log.debug("[IntentMatcher] no intent above threshold (best={})", bestScore);
            return IntentMatch.unknown();
        }
        return new IntentMatch(bestIntent, bestScore);
    }

    private double scoreIntent(String normalizedMessage, Set<String> messageWords, List<String> patterns) {
        double max = 0.0;
        for (String rawPattern : patterns) {
            String pattern = rawPattern.toLowerCase(Locale.ROOT);
            Set<String> patternWords = wordsOf(pattern);

            Set<String> union = new HashSet<>(messageWords);
            union.addAll(patternWords);
            if (!union.isEmpty()) {
                Set<String> intersection = new HashSet<>(messageWords);
                intersection.retainAll(patternWords);
                max = Math.max(max, (double) intersection.size() / union.size());
            }

            if (!pattern.isEmpty() && normalizedMessage.contains(pattern)) {
                max = Math.max(max, SUBSTRING_BOOST);
            }
        }
        return max;
    }

    static Set<String> wordsOf(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return Collections.emptySet();
        }
        return new HashSet<>(List.of(trimmed.split("\\s+")));
    }
}
