package com.ledgerly.backend.chatbot.entities;

import java.util.List;

/**
 * One stage of the entity extraction pipeline. Stages are independent; each adds what it finds
 * to the shared builder. Ordering comes from {@link org.springframework.core.annotation.Order}.
 */
public interface StructuredEntityContributor {

    void contribute(String message, List<ExtractedEntity> namedEntities, StructuredEntities.Builder entities);
}
