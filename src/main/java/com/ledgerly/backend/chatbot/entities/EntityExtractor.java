package com.ledgerly.backend.chatbot.entities;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the tagger once per message and feeds its spans, together with the raw text, through the
 * ordered contributor pipeline.
 *
 * A missing or failing tagger only costs the date/time entities; it never fails the message.
 */
@Component
@Slf4j
public class EntityExtractor {

    private final List<StructuredEntityContributor> contributors;
    private final Optional<NamedEntityTagger> tagger;

    public EntityExtractor(List<StructuredEntityContributor> contributors, Optional<NamedEntityTagger> tagger) {
        this.contributors = List.copyOf(contributors);
        this.tagger = tagger;
        if (tagger.isEmpty()) {
            log.warn("[EntityExtractor] No named-entity tagger available; date extraction disabled");
        }
    }

    public StructuredEntities extract(String message) {
        return analyze(message).structured();
    }

    public List<ExtractedEntity> tag(String message) {
        if (tagger.isEmpty() || message == null || message.isBlank()) {
            return List.of();
        }
        try {
            List<ExtractedEntity> tagged = tagger.get().tag(message);
            return tagged != null ? tagged : List.of();
        } catch (RuntimeException e) {
            log.warn("[EntityExtractor] Tagger failed, continuing without named entities: {}", e.getMessage());
            return List.of();
        }
    }

    public EntityAnalysis analyze(String message) {
        String text = message != null ? message : "";
        List<ExtractedEntity> namedEntities = tag(text);

        StructuredEntities.Builder builder = StructuredEntities.builder();
        for (StructuredEntityContributor contributor : contributors) {
            contributor.contribute(text, namedEntities, builder);
        }
        StructuredEntities structured = builder.build();

        log.debug("[EntityExtractor] amounts={} dates={} categories={}",
                structured.amounts(), structured.dates(), structured.categories());
        return new EntityAnalysis(structured, namedEntities);
    }

    /**
     * Both views of one message: the purpose-built entities and the tagger's raw spans.
     */
    public record EntityAnalysis(StructuredEntities structured, List<ExtractedEntity> namedEntities) {}
}
