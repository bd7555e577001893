package com.ledgerly.backend.chatbot.responses;

import java.util.Set;

/**
 * Answers one or more intents. Implementations are discovered as beans; each intent name may be
 * claimed by a single builder.
 */
public interface ResponseBuilder {

    Set<String> intents();

    ChatReply build(ResponseContext context);
}
