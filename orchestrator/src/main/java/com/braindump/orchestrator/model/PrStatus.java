package com.braindump.orchestrator.model;

public enum PrStatus implements PersistedValue {

    DRAFT("draft"),
    OPEN("open"),
    MERGED("merged"),
    CLOSED("closed");

    private final String value;

    PrStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static PrStatus fromValue(String value) {
        return PersistedValue.fromValue(PrStatus.class, value);
    }
}
