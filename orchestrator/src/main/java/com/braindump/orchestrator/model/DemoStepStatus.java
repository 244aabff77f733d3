package com.braindump.orchestrator.model;

public enum DemoStepStatus implements PersistedValue {

    PENDING("pending"),
    PASSED("passed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    DemoStepStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static DemoStepStatus fromValue(String value) {
        return PersistedValue.fromValue(DemoStepStatus.class, value);
    }
}
