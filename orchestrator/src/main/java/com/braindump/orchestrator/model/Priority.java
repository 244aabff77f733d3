package com.braindump.orchestrator.model;

public enum Priority implements PersistedValue {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Priority(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static Priority fromValue(String value) {
        return PersistedValue.fromValue(Priority.class, value);
    }
}
