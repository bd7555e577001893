package com.ledgerly.backend.enums;

/**
 * Labels produced by the named-entity tagger. Only DATE and TIME feed the date extraction;
 * the rest are reported back to the caller as-is.
 */
public enum EntityLabel {
    DATE,
    TIME,
    MONEY;

    public boolean isTemporal() {
        return this == DATE || this == TIME;
    }
}
