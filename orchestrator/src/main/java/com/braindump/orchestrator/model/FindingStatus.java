package com.braindump.orchestrator.model;

public enum FindingStatus implements PersistedValue {

    OPEN("open"),
    FIXED("fixed");

    private final String value;

    FindingStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static FindingStatus fromValue(String value) {
        return PersistedValue.fromValue(FindingStatus.class, value);
    }
}
