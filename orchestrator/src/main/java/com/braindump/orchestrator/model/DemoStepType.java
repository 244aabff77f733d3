package com.braindump.orchestrator.model;

public enum DemoStepType implements PersistedValue {

    MANUAL("manual"),
    VISUAL("visual"),
    AUTOMATED("automated");

    private final String value;

    DemoStepType(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static DemoStepType fromValue(String value) {
        return PersistedValue.fromValue(DemoStepType.class, value);
    }
}
