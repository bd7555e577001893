package com.ledgerly.backend.chatbot;

import java.util.List;
import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerly.backend.chatbot.dto.ChatMessageRequestDTO;
import com.ledgerly.backend.chatbot.dto.ChatResponseDTO;
import com.ledgerly.backend.dto.ApiResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/chatbot")
@RequiredArgsConstructor
public class ChatbotController {

    private final ConversationOrchestrator orchestrator;

    @PostMapping("/{userId}/chat")
    public ResponseEntity<ApiResponse<ChatResponseDTO>> chat(
            @PathVariable UUID userId,
            @Valid @RequestBody ChatMessageRequestDTO request
    ) {
        ChatResponseDTO response = orchestrator.processMessage(userId, request.message(), request.conversationId());
        return ResponseEntity.ok(ApiResponse.success(response, "Message processed"));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<ApiResponse<List<String>>> suggestions() {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.suggestions(), "Suggestions loaded"));
    }
}
