package com.ledgerly.backend.chatbot.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatMessageRequestDTO(
        @NotBlank(message = "Message is required")
        @Size(max = 1000, message = "Message must be at most 1000 characters")
        String message,

        @Size(max = 100, message = "conversationId must be at most 100 characters")
        String conversationId
) {}
