package com.braindump.orchestrator.model;

import com.braindump.orchestrator.model.convert.EnumConverters.WorkflowPhaseConverter;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-ticket review loop bookkeeping. Secondary data: losing an update here never
 * invalidates the ticket's status.
 *
 * DB table: ticket_workflow_state
 */
@Entity
@Table(name = "ticket_workflow_state")
public class TicketWorkflowState {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ticket_id", nullable = false, unique = true)
    private UUID ticketId;

    @Convert(converter = WorkflowPhaseConverter.class)
    @Column(name = "current_phase", nullable = false)
    private WorkflowPhase phase;

    @Column(name = "review_iteration", nullable = false)
    private int reviewIteration;

    @Column(name = "findings_count", nullable = false)
    private int findingsCount;

    @Column(name = "findings_fixed", nullable = false)
    private int findingsFixed;

    @Column(name = "demo_generated", nullable = false)
    private boolean demoGenerated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected TicketWorkflowState() {}

    public TicketWorkflowState(UUID ticketId, WorkflowPhase phase, int reviewIteration) {
        this.ticketId        = ticketId;
        this.phase           = phase;
        this.reviewIteration = reviewIteration;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** Work (re)starts from scratch: every counter goes back to zero. */
    public void resetForImplementation() {
        this.phase           = WorkflowPhase.IMPLEMENTATION;
        this.reviewIteration = 0;
        this.findingsCount   = 0;
        this.findingsFixed   = 0;
        this.demoGenerated   = false;
    }

    public void enterAiReview() {
        this.phase = WorkflowPhase.AI_REVIEW;
        this.reviewIteration++;
    }

    /** Fix loop: back to implementation, keeping the iteration count. */
    public void returnToImplementation() {
        this.phase = WorkflowPhase.IMPLEMENTATION;
    }

    public void recordFinding()  { this.findingsCount++; }
    public void recordFix()      { this.findingsFixed++; }

    public void markDemoGenerated() {
        this.demoGenerated = true;
        this.phase         = WorkflowPhase.HUMAN_REVIEW;
    }

    public UUID getId()              { return id; }
    public UUID getTicketId()        { return ticketId; }
    public WorkflowPhase getPhase()  { return phase; }
    public int getReviewIteration()  { return reviewIteration; }
    public int getFindingsCount()    { return findingsCount; }
    public int getFindingsFixed()    { return findingsFixed; }
    public boolean isDemoGenerated() { return demoGenerated; }
    public Instant getUpdatedAt()    { return updatedAt; }
}
