package com.braindump.orchestrator.model;

/**
 * Severity of a review finding. Open CRITICAL and MAJOR findings keep a ticket
 * out of human review.
 */
public enum FindingSeverity implements PersistedValue {

    CRITICAL("critical", true),
    MAJOR("major", true),
    MINOR("minor", false),
    SUGGESTION("suggestion", false);

    private final String value;
    private final boolean blocking;

    FindingSeverity(String value, boolean blocking) {
        this.value    = value;
        this.blocking = blocking;
    }

    @Override
    public String value() {
        return value;
    }

    public boolean isBlocking() {
        return blocking;
    }

    public static FindingSeverity fromValue(String value) {
        return PersistedValue.fromValue(FindingSeverity.class, value);
    }
}
