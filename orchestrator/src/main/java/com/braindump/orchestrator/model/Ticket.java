package com.braindump.orchestrator.model;

import com.braindump.orchestrator.model.convert.EnumConverters.PriorityConverter;
import com.braindump.orchestrator.model.convert.EnumConverters.TicketStatusConverter;
import com.braindump.orchestrator.model.convert.TicketMetadataConverter;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A unit of work inside a project, optionally grouped under an epic.
 *
 * Status changes go through {@link #transitionTo(TicketStatus)}, which enforces
 * the lifecycle in {@link TicketStatus}.
 *
 * DB table: tickets
 */
@Entity
@Table(name = "tickets")
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = TicketStatusConverter.class)
    @Column(nullable = false)
    private TicketStatus status = TicketStatus.BACKLOG;

    @Convert(converter = PriorityConverter.class)
    private Priority priority;

    // Board ordering within a column.
    @Column(nullable = false)
    private double position;

    @ManyToOne(optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @ManyToOne
    @JoinColumn(name = "epic_id")
    private Epic epic;

    @Convert(converter = TicketMetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    private TicketMetadata metadata = TicketMetadata.empty();

    @Column(name = "branch_name")
    private String branchName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Ticket() {}

    public Ticket(Project project, Epic epic, String title, double position) {
        this.project  = project;
        this.epic     = epic;
        this.title    = title;
        this.position = position;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Moves the ticket to {@code next}.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public void transitionTo(TicketStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal ticket transition " + status.value() + " -> " + next.value());
        }
        this.status = next;
        this.completedAt = next == TicketStatus.DONE ? Instant.now() : null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID getId()                 { return id; }
    public String getTitle()            { return title; }
    public String getDescription()      { return description; }
    public TicketStatus getStatus()     { return status; }
    public Priority getPriority()       { return priority; }
    public double getPosition()         { return position; }
    public Project getProject()         { return project; }
    public Epic getEpic()               { return epic; }
    public TicketMetadata getMetadata() { return metadata; }
    public String getBranchName()       { return branchName; }
    public Instant getCreatedAt()       { return createdAt; }
    public Instant getUpdatedAt()       { return updatedAt; }
    public Instant getCompletedAt()     { return completedAt; }

    public void setDescription(String description)     { this.description = description; }
    public void setPriority(Priority priority)         { this.priority = priority; }
    public void setMetadata(TicketMetadata metadata)   { this.metadata = metadata; }
    public void setBranchName(String branchName)       { this.branchName = branchName; }
}
