package com.taintgrep.engine.domain;

/**
 * Finding confidence. Taint verification moves it one step up or down.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    public Confidence raise() {
        return this == HIGH ? HIGH : values()[ordinal() + 1];
    }

    public Confidence lower() {
        return this == LOW ? LOW : values()[ordinal() - 1];
    }
}
