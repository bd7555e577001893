package com.ledgerly.backend.chatbot.entities;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.enums.EntityLabel;

/**
 * Regex tagger for the spans the chat pipeline cares about: dates, times and money.
 *
 * Best-effort only. Candidates from every rule are collected, then resolved left to right with
 * the longest span winning at the same start; overlapping later spans are dropped.
 * Disable with {@code ledgerly.chatbot.tagger.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "ledgerly.chatbot.tagger.enabled", havingValue = "true", matchIfMissing = true)
public class RuleBasedNamedEntityTagger implements NamedEntityTagger {

    private static final String MONTH =
            "(?:january|february|march|april|june|july|august|september|october|november|december"
                    + "|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)";
    private static final String DAY = "\\d{1,2}(?:st|nd|rd|th)?";
    private static final String UNIT = "(?:days?|weeks?|months?|years?)";
    private static final String WEEKDAY = "(?:monday|tuesday|wednesday|thursday|friday|saturday|sunday)s?";

    private record Rule(EntityLabel label, Pattern pattern) {}

    private static final List<Rule> RULES = List.of(
            // DATE
            rule(EntityLabel.DATE, "\\b\\d{4}-\\d{2}-\\d{2}\\b"),
            rule(EntityLabel.DATE, "\\b\\d{1,2}/\\d{1,2}(?:/\\d{2,4})?\\b"),
            rule(EntityLabel.DATE, "\\b" + MONTH + "\\.?(?:\\s+" + DAY + ")?(?:,?\\s+\\d{4})?\\b"),
            rule(EntityLabel.DATE, "\\bmay\\s+" + DAY + "(?:,?\\s+\\d{4})?\\b"),
            rule(EntityLabel.DATE, "\\bmay,?\\s+\\d{4}\\b"),
            rule(EntityLabel.DATE, "\\b(?:today|yesterday|tomorrow)\\b"),
            rule(EntityLabel.DATE, "\\b(?:this|last|next|past|previous)\\s+(?:week|weekend|month|quarter|year)\\b"),
            rule(EntityLabel.DATE, "\\b(?:the\\s+)?(?:last|past|previous|next)\\s+(?:\\d+|few|couple of)\\s+" + UNIT + "\\b"),
            rule(EntityLabel.DATE, "\\b\\d+\\s+" + UNIT + "\\s+ago\\b"),
            rule(EntityLabel.DATE, "\\b(?:(?:last|next|this)\\s+)?" + WEEKDAY + "\\b"),
            rule(EntityLabel.DATE, "\\b(?:19|20)\\d{2}\\b"),
            // TIME
            rule(EntityLabel.TIME, "\\b\\d{1,2}(?::\\d{2})?\\s*(?:am|pm|a\\.m\\.|p\\.m\\.)(?![a-z])"),
            rule(EntityLabel.TIME, "\\b\\d{1,2}:\\d{2}\\b"),
            rule(EntityLabel.TIME, "\\b(?:noon|midnight|tonight)\\b"),
            rule(EntityLabel.TIME, "\\b(?:this|yesterday|tomorrow)\\s+(?:morning|afternoon|evening|night)\\b"),
            // MONEY
            rule(EntityLabel.MONEY, "\\$\\s?\\d+(?:,\\d{3})*(?:\\.\\d{1,2})?"),
            rule(EntityLabel.MONEY, "\\b\\d+(?:,\\d{3})*(?:\\.\\d{1,2})?\\s+(?:dollars?|bucks|usd)\\b")
    );

    private static Rule rule(EntityLabel label, String regex) {
        return new Rule(label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    @Override
    public List<ExtractedEntity> tag(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<ExtractedEntity> candidates = new ArrayList<>();
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(text);
            while (m.find()) {
                if (m.end() > m.start()) {
                    candidates.add(new ExtractedEntity(m.group(), rule.label(), m.start(), m.end()));
                }
            }
        }

        candidates.sort(Comparator
                .comparingInt(ExtractedEntity::startOffset)
                .thenComparing(Comparator.comparingInt(ExtractedEntity::length).reversed()));

        List<ExtractedEntity> accepted = new ArrayList<>();
        for (ExtractedEntity candidate : candidates) {
            boolean clash = accepted.stream().anyMatch(candidate::overlaps);
            if (!clash) {
                accepted.add(candidate);
            }
        }
        return List.copyOf(accepted);
    }
}
