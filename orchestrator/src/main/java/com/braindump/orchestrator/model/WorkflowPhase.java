package com.braindump.orchestrator.model;

/** Fine-grained position of a ticket inside the implement/review loop. */
public enum WorkflowPhase implements PersistedValue {

    IMPLEMENTATION("implementation"),
    AI_REVIEW("ai_review"),
    HUMAN_REVIEW("human_review");

    private final String value;

    WorkflowPhase(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static WorkflowPhase fromValue(String value) {
        return PersistedValue.fromValue(WorkflowPhase.class, value);
    }
}
