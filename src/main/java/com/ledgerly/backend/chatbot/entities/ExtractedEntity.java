package com.ledgerly.backend.chatbot.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledgerly.backend.enums.EntityLabel;

/**
 * A tagged span of the original message; offsets are character offsets, end exclusive.
 */
public record ExtractedEntity(
        String text,
        EntityLabel label,
        @JsonProperty("start") int startOffset,
        @JsonProperty("end") int endOffset
) {
    public ExtractedEntity {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid span [" + startOffset + ", " + endOffset + ")");
        }
    }

    public int length() {
        return endOffset - startOffset;
    }

    public boolean overlaps(ExtractedEntity other) {
        return startOffset < other.endOffset && other.startOffset < endOffset;
    }
}
