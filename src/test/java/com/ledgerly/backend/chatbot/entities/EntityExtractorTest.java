package com.ledgerly.backend.chatbot.entities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.ledgerly.backend.enums.EntityLabel;

class EntityExtractorTest {

    private static List<StructuredEntityContributor> contributors() {
        return List.of(new AmountEntityContributor(), new TemporalEntityContributor(), new CategoryKeywordContributor());
    }

    private final EntityExtractor extractor =
            new EntityExtractor(contributors(), Optional.of(new RuleBasedNamedEntityTagger()));

    @Test
    void extract_amountsWithSeparatorsAndCents_parsedInOrder() {
        StructuredEntities entities = extractor.extract("I spent $1,250.50 and then 45 more");

        assertEquals(List.of(new BigDecimal("1250.50"), new BigDecimal("45")), entities.amounts());
    }

    @Test
    void extract_categoryKeywords_keepVocabularyOrderWithoutDuplicates() {
        StructuredEntities entities = extractor.extract("Gas and FOOD, then more food and dining");

        assertEquals(List.of("food", "dining", "gas"), List.copyOf(entities.categories()));
    }

    @Test
    void extract_categoryKeywords_matchAsSubstrings() {
        // "savings" contains no other keyword, "bills" is found inside "billsplit"
        StructuredEntities entities = extractor.extract("my savings and billsplit");

        assertEquals(List.of("bills", "savings"), List.copyOf(entities.categories()));
    }

    @Test
    void extract_dateMentions_comeFromTagger() {
        StructuredEntities entities = extractor.extract("What did I spend last week on food?");

        assertEquals(List.of("last week"), entities.dates());
        assertEquals(List.of("food"), List.copyOf(entities.categories()));
        assertTrue(entities.amounts().isEmpty());
    }

    @Test
    void extract_emptyMessage_returnsEmptyEntities() {
        StructuredEntities entities = extractor.extract("");

        assertEquals(StructuredEntities.empty(), entities);
    }

    @Test
    void extract_nullMessage_returnsEmptyEntities() {
        assertEquals(StructuredEntities.empty(), extractor.extract(null));
    }

    @Test
    void extract_taggerThrows_keepsAmountsAndCategoriesWithoutDates() {
        NamedEntityTagger failing = mock(NamedEntityTagger.class);
        when(failing.tag(anyString())).thenThrow(new IllegalStateException("model not loaded"));
        EntityExtractor withFailingTagger = new EntityExtractor(contributors(), Optional.of(failing));

        StructuredEntities entities = withFailingTagger.extract("Paid $20 for gas yesterday");

        assertEquals(List.of(new BigDecimal("20")), entities.amounts());
        assertEquals(List.of("gas"), List.copyOf(entities.categories()));
        assertTrue(entities.dates().isEmpty());
    }

    @Test
    void extract_noTagger_keepsAmountsAndCategoriesWithoutDates() {
        EntityExtractor withoutTagger = new EntityExtractor(contributors(), Optional.empty());

        StructuredEntities entities = withoutTagger.extract("Paid $20 for gas yesterday");

        assertEquals(List.of(new BigDecimal("20")), entities.amounts());
        assertTrue(entities.dates().isEmpty());
        assertTrue(withoutTagger.tag("Paid $20 for gas yesterday").isEmpty());
    }

    @Test
    void analyze_returnsTaggerSpansAlongsideStructuredEntities() {
        EntityExtractor.EntityAnalysis analysis = extractor.analyze("Find the $45 charge from yesterday");

        assertEquals(List.of(new BigDecimal("45")), analysis.structured().amounts());
        assertTrue(analysis.namedEntities().stream()
                .anyMatch(e -> e.label() == EntityLabel.MONEY && e.text().equals("$45")));
        assertTrue(analysis.namedEntities().stream()
                .anyMatch(e -> e.label() == EntityLabel.DATE && e.text().equals("yesterday")));
    }

    @Test
    void tag_nullResultFromTagger_isTreatedAsEmpty() {
        NamedEntityTagger silent = mock(NamedEntityTagger.class);
        when(silent.tag(anyString())).thenReturn(null);
        EntityExtractor withSilentTagger = new EntityExtractor(contributors(), Optional.of(silent));

        assertTrue(withSilentTagger.tag("anything").isEmpty());
    }
}
