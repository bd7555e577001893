package com.ledgerly.backend.chatbot;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.ledgerly.backend.chatbot.dto.ChatResponseDTO;
import com.ledgerly.backend.chatbot.entities.EntityExtractor;
import com.ledgerly.backend.chatbot.entities.EntityExtractor.EntityAnalysis;
import com.ledgerly.backend.chatbot.entities.StructuredEntities;
import com.ledgerly.backend.chatbot.intent.IntentMatch;
import com.ledgerly.backend.chatbot.intent.IntentMatcher;
import com.ledgerly.backend.chatbot.responses.ChatReply;
import com.ledgerly.backend.chatbot.responses.ResponseBuilder;
import com.ledgerly.backend.chatbot.responses.ResponseContext;
import com.ledgerly.backend.config.ChatbotProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns one chat message into one answer.
 *
 * Intent matching and entity extraction run side by side on the analysis executor; the intent
 * then selects exactly one {@link ResponseBuilder}. Unknown intents, intents without a builder
 * and builder failures all end in {@link #FALLBACK_TEXT}. No state is kept between messages
 * besides the echoed conversation id.
 */
@Service
@Slf4j
public class ConversationOrchestrator {

    public static final String FALLBACK_TEXT =
            "I'm not sure how to help with that. Try asking about your balance, spending, or budget!";

    private final IntentMatcher intentMatcher;
    private final EntityExtractor entityExtractor;
    private final ChatbotProperties properties;
    private final Executor analysisExecutor;
    private final Map<String, ResponseBuilder> builders;

    public ConversationOrchestrator(
            IntentMatcher intentMatcher,
            EntityExtractor entityExtractor,
            List<ResponseBuilder> responseBuilders,
            ChatbotProperties properties,
            @Qualifier("chatAnalysisExecutor") Executor analysisExecutor
    ) {
        this.intentMatcher = intentMatcher;
        this.entityExtractor = entityExtractor;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;

        Map<String, ResponseBuilder> byIntent = new HashMap<>();
        for (ResponseBuilder builder : responseBuilders) {
            for (String intent : builder.intents()) {
                ResponseBuilder previous = byIntent.putIfAbsent(intent, builder);
                if (previous != null) {
                    throw new IllegalStateException("Intent '" + intent + "' is handled by both "
                            + previous.getClass().getSimpleName() + " and " + builder.getClass().getSimpleName());
                }
            }
        }
        this.builders = Map.copyOf(byIntent);
    }

    public ChatResponseDTO processMessage(UUID userId, String message, String conversationId) {
        String text = message != null ? message : "";
        String conversation = conversationId == null || conversationId.isBlank()
                ? UUID.randomUUID().toString()
                : conversationId;

        CompletableFuture<IntentMatch> intentTask = submit(() -> intentMatcher.classify(text));
        CompletableFuture<EntityAnalysis> entityTask = submit(() -> entityExtractor.analyze(text));

        IntentMatch intent = await(intentTask, IntentMatch.unknown(), "intent matching");
        EntityAnalysis entities = await(entityTask,
                new EntityAnalysis(StructuredEntities.empty(), List.of()), "entity extraction");

        log.debug("[ConversationOrchestrator] userId={} conversation={} intent={} confidence={}",
                userId, conversation, intent.intent(), intent.confidence());

        ClassificationResult classification =
                new ClassificationResult(intent.intent(), intent.confidence(), entities.namedEntities());
        ChatReply reply = reply(new ResponseContext(userId, text, intent, entities.structured()));
        return new ChatResponseDTO(
                reply.text(),
                classification.intent(),
                classification.confidence(),
                classification.entities(),
                conversation,
                reply.chartData(),
                reply.actions()
        );
    }

    public List<String> suggestions() {
        return properties.suggestions();
    }

    private ChatReply reply(ResponseContext context) {
        ResponseBuilder builder = context.intent().isUnknown() ? null : builders.get(context.intent().intent());
        if (builder == null) {
            return ChatReply.text(FALLBACK_TEXT);
        }
        try {
            ChatReply reply = builder.build(context);
            return reply != null ? reply : ChatReply.text(FALLBACK_TEXT);
        } catch (RuntimeException e) {
            log.warn("[ConversationOrchestrator] {} failed for intent={}: {}",
                    builder.getClass().getSimpleName(), context.intent().intent(), e.getMessage(), e);
            return ChatReply.text(FALLBACK_TEXT);
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, analysisExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[ConversationOrchestrator] Analysis executor saturated, running inline");
            return CompletableFuture.completedFuture(task.get());
        }
    }

    private static <T> T await(CompletableFuture<T> task, T fallback, String step) {
        try {
            return task.join();
        } catch (CompletionException e) {
            log.warn("[ConversationOrchestrator] {} failed, using defaults: {}", step, e.getMessage());
            return fallback;
        }
    }
}
