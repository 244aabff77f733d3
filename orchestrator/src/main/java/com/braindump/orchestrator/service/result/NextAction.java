package com.braindump.orchestrator.service.result;

import com.braindump.orchestrator.model.TicketStatus;

import java.util.List;

/** What the caller should do next after a workflow operation. */
public enum NextAction {

    RUN_REVIEW_AGENTS("Run the review agents against the ticket's changes"),
    SUBMIT_FINDINGS("Submit each review finding"),
    FIX_BLOCKING_FINDINGS("Fix open critical and major findings, then mark them fixed"),
    CHECK_REVIEW_COMPLETE("Check whether the review gate allows human review"),
    GENERATE_DEMO_SCRIPT("Generate a demo script for human verification"),
    AWAIT_HUMAN_APPROVAL("Wait for a human to run the demo and approve the ticket");

    private final String description;

    NextAction(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }

    /** Guidance for a ticket that currently sits in {@code status}. */
    public static List<NextAction> forStatus(TicketStatus status) {
        return switch (status) {
            case AI_REVIEW -> List.of(RUN_REVIEW_AGENTS, SUBMIT_FINDINGS, FIX_BLOCKING_FINDINGS,
                                      CHECK_REVIEW_COMPLETE, GENERATE_DEMO_SCRIPT);
            case HUMAN_REVIEW -> List.of(AWAIT_HUMAN_APPROVAL);
            default -> List.of();
        };
    }
}
