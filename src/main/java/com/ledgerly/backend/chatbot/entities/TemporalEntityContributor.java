package com.ledgerly.backend.chatbot.entities;

import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Date and time mentions, taken from the tagger's DATE/TIME spans in source order.
 */
@Component
@Order(20)
public class TemporalEntityContributor implements StructuredEntityContributor {

    @Override
    public void contribute(String message, List<ExtractedEntity> namedEntities, StructuredEntities.Builder entities) {
        for (ExtractedEntity entity : namedEntities) {
            if (entity.label() != null && entity.label().isTemporal()) {
                entities.date(entity.text());
            }
        }
    }
}
