package com.braindump.orchestrator.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Ticket lifecycle.
 *
 * <pre>
 *   BACKLOG ⇄ READY → IN_PROGRESS → AI_REVIEW → HUMAN_REVIEW → DONE
 *                          ↑______________|            |
 *                          ↑___________________________|
 * </pre>
 *
 * The workflow engine never moves a ticket to DONE; only a human does.
 */
public enum TicketStatus implements PersistedValue {

    BACKLOG("backlog"),
    READY("ready"),
    IN_PROGRESS("in_progress"),
    AI_REVIEW("ai_review"),
    HUMAN_REVIEW("human_review"),
    DONE("done");

    private static final Map<TicketStatus, Set<TicketStatus>> TRANSITIONS = new EnumMap<>(TicketStatus.class);

    static {
        TRANSITIONS.put(BACKLOG,      EnumSet.of(READY, IN_PROGRESS));
        TRANSITIONS.put(READY,        EnumSet.of(BACKLOG, IN_PROGRESS));
        TRANSITIONS.put(IN_PROGRESS,  EnumSet.of(AI_REVIEW));
        TRANSITIONS.put(AI_REVIEW,    EnumSet.of(IN_PROGRESS, HUMAN_REVIEW));
        TRANSITIONS.put(HUMAN_REVIEW, EnumSet.of(IN_PROGRESS, DONE));
        TRANSITIONS.put(DONE,         EnumSet.noneOf(TicketStatus.class));
    }

    private final String value;

    TicketStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public boolean canTransitionTo(TicketStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public static TicketStatus fromValue(String value) {
        return PersistedValue.fromValue(TicketStatus.class, value);
    }
}
