package com.ledgerly.backend.chatbot.responses;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.ledgerly.backend.chatbot.entities.StructuredEntities;
import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.chatbot.intent.IntentDefinition;
import com.ledgerly.backend.chatbot.intent.IntentMatch;
import com.ledgerly.backend.chatbot.intent.IntentTable;

class TemplateResponseBuilderTest {

    private final IntentTable table = new IntentTable(IntentCatalog.defaultIntents());
    private final TemplateResponseBuilder builder = new TemplateResponseBuilder(table);

    private static ResponseContext context(String intent) {
        return new ResponseContext(UUID.randomUUID(), "hi", new IntentMatch(intent, 1.0), StructuredEntities.empty());
    }

    @Test
    void build_greeting_picksOneOfItsTemplates() {
        List<String> templates = table.find(IntentCatalog.GREETING).orElseThrow().responseTemplates();

        for (int i = 0; i < 20; i++) {
            assertTrue(templates.contains(builder.build(context(IntentCatalog.GREETING)).text()));
        }
    }

    @Test
    void build_intentWithoutTemplates_throws() {
        TemplateResponseBuilder empty = new TemplateResponseBuilder(new IntentTable(List.of(
                new IntentDefinition(IntentCatalog.GOODBYE, List.of("bye"), List.of()))));

        assertThrows(IllegalStateException.class, () -> empty.build(context(IntentCatalog.GOODBYE)));
    }
}
