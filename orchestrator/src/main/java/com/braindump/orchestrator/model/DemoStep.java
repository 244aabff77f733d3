package com.braindump.orchestrator.model;

/** One step of a human-facing demo script. */
public record DemoStep(
        int order,
        String description,
        String expectedOutcome,
        DemoStepType type,
        DemoStepStatus status,
        String notes
) {

    public DemoStep {
        if (type == null)   type   = DemoStepType.MANUAL;
        if (status == null) status = DemoStepStatus.PENDING;
    }
}
