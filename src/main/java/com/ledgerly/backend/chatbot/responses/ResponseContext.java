package com.ledgerly.backend.chatbot.responses;

import java.util.UUID;

import com.ledgerly.backend.chatbot.entities.StructuredEntities;
import com.ledgerly.backend.chatbot.intent.IntentMatch;

public record ResponseContext(UUID userId, String message, IntentMatch intent, StructuredEntities entities) {}
