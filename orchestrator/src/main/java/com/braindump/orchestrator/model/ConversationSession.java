package com.braindump.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of an agent session working on a ticket. Open while endedAt is null.
 *
 * DB table: conversation_sessions
 */
@Entity
@Table(name = "conversation_sessions")
public class ConversationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ticket_id", nullable = false)
    private UUID ticketId;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    // Where the agent runs, e.g. "claude-code" or "vscode".
    @Column(nullable = false)
    private String environment;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "ended_at")
    private Instant endedAt;

    protected ConversationSession() {}

    public ConversationSession(UUID ticketId, UUID projectId, String environment) {
        this.ticketId    = ticketId;
        this.projectId   = projectId;
        this.environment = environment;
    }

    public void end() {
        if (endedAt == null) {
            endedAt = Instant.now();
        }
    }

    public boolean isActive() { return endedAt == null; }

    public UUID getId()            { return id; }
    public UUID getTicketId()      { return ticketId; }
    public UUID getProjectId()     { return projectId; }
    public String getEnvironment() { return environment; }
    public Instant getStartedAt()  { return startedAt; }
    public Instant getEndedAt()    { return endedAt; }
}
