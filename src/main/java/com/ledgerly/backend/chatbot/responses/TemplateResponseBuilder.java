package com.ledgerly.backend.chatbot.responses;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.chatbot.intent.IntentTable;

/**
 * Small-talk intents answered with one of the intent's canned templates, picked at random.
 */
@Component
@Order(10)
public class TemplateResponseBuilder implements ResponseBuilder {

    private static final Set<String> INTENTS = Set.of(IntentCatalog.GREETING, IntentCatalog.HELP, IntentCatalog.GOODBYE);

    private final IntentTable intentTable;

    public TemplateResponseBuilder(IntentTable intentTable) {
        this.intentTable = intentTable;
    }

    @Override
    public Set<String> intents() {
        return INTENTS;
    }

    @Override
    public ChatReply build(ResponseContext context) {
        String intent = context.intent().intent();
        return intentTable.randomTemplate(intent, ThreadLocalRandom.current())
                .map(ChatReply::text)
                .orElseThrow(() -> new IllegalStateException("No response template for intent " + intent));
    }
}
