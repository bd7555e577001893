package com.ledgerly.backend.chatbot.entities;

import java.util.List;

/**
 * Pluggable named-entity tagger. Implementations return spans in source order and must not
 * perform blocking I/O on the request path.
 */
public interface NamedEntityTagger {

    List<ExtractedEntity> tag(String text);
}
