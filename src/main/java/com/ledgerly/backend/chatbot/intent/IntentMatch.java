package com.ledgerly.backend.chatbot.intent;

public record IntentMatch(String intent, double confidence) {

    public static final String UNKNOWN = "unknown";

    public static IntentMatch unknown() {
        return new IntentMatch(UNKNOWN, 0.0);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(intent);
    }
}
