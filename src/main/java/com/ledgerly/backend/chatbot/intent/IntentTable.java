package com.ledgerly.backend.chatbot.intent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Immutable, ordered intent table. Scan order is the tie-break order of {@link IntentMatcher}.
 */
public final class IntentTable {

    private final List<IntentDefinition> intents;
    private final Map<String, IntentDefinition> byName;

    public IntentTable(List<IntentDefinition> intents) {
        if (intents == null || intents.isEmpty()) {
            throw new IllegalArgumentException("intent table must not be empty");
        }
        Map<String, IntentDefinition> index = new LinkedHashMap<>();
        for (IntentDefinition intent : intents) {
            if (index.putIfAbsent(intent.name(), intent) != null) {
                throw new IllegalArgumentException("duplicate intent: " + intent.name());
            }
        }
        this.intents = List.copyOf(intents);
        this.byName = index;
    }

    public List<IntentDefinition> intents() {
        return intents;
    }

    public Optional<IntentDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<String> randomTemplate(String name, Random random) {
        return find(name)
                .map(IntentDefinition::responseTemplates)
                .filter(templates -> !templates.isEmpty())
                .map(templates -> templates.get(random.nextInt(templates.size())));
    }
}
