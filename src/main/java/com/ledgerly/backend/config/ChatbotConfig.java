package com.ledgerly.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ledgerly.backend.chatbot.intent.IntentCatalog;
import com.ledgerly.backend.chatbot.intent.IntentTable;

@Configuration
public class ChatbotConfig {

    @Bean
    public IntentTable intentTable() {
        return new IntentTable(IntentCatalog.defaultIntents());
    }
}
