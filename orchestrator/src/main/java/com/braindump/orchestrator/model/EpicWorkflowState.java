package com.braindump.orchestrator.model;

import com.braindump.orchestrator.model.convert.EnumConverters.PrStatusConverter;
import jakarta.persistence.*;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Git and pull-request state of an epic: the shared branch, an optional worktree,
 * the draft PR and progress counters. At most one row per epic.
 *
 * DB table: epic_workflow_state
 */
@Entity
@Table(name = "epic_workflow_state")
public class EpicWorkflowState {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "epic_id", nullable = false, unique = true)
    private UUID epicId;

    @Column(name = "epic_branch_name")
    private String epicBranchName;

    @Column(name = "epic_branch_created_at")
    private Instant epicBranchCreatedAt;

    // Set only when the epic uses worktree isolation.
    @Column(name = "worktree_path", columnDefinition = "TEXT")
    private String worktreePath;

    @Column(name = "current_ticket_id")
    private UUID currentTicketId;

    @Column(name = "pr_number")
    private Integer prNumber;

    @Column(name = "pr_url", columnDefinition = "TEXT")
    private String prUrl;

    @Convert(converter = PrStatusConverter.class)
    @Column(name = "pr_status")
    private PrStatus prStatus;

    @Column(name = "tickets_total", nullable = false)
    private int ticketsTotal;

    @Column(name = "tickets_done", nullable = false)
    private int ticketsDone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected EpicWorkflowState() {}

    public EpicWorkflowState(UUID epicId) {
        this.epicId = epicId;
    }

    // ------------------------------------------------------------------
    // Mutators
    // ------------------------------------------------------------------

    public void recordBranch(String branchName, Path worktree) {
        this.epicBranchName      = branchName;
        this.epicBranchCreatedAt = Instant.now();
        this.worktreePath        = worktree == null ? null : worktree.toString();
    }

    public void recordPullRequest(int number, String url, PrStatus status) {
        this.prNumber = number;
        this.prUrl    = url;
        this.prStatus = status;
    }

    public void updateProgress(int total, int done) {
        this.ticketsTotal = total;
        this.ticketsDone  = done;
    }

    /** Directory where the epic branch is checked out: the worktree if any, else the project itself. */
    public Path workingDirectory(Path projectPath) {
        return worktreePath != null ? Path.of(worktreePath) : projectPath;
    }

    public UUID getId()                     { return id; }
    public UUID getEpicId()                 { return epicId; }
    public String getEpicBranchName()       { return epicBranchName; }
    public Instant getEpicBranchCreatedAt() { return epicBranchCreatedAt; }
    public String getWorktreePath()         { return worktreePath; }
    public UUID getCurrentTicketId()        { return currentTicketId; }
    public Integer getPrNumber()            { return prNumber; }
    public String getPrUrl()                { return prUrl; }
    public PrStatus getPrStatus()           { return prStatus; }
    public int getTicketsTotal()            { return ticketsTotal; }
    public int getTicketsDone()             { return ticketsDone; }
    public Instant getUpdatedAt()           { return updatedAt; }

    public void setCurrentTicketId(UUID ticketId) { this.currentTicketId = ticketId; }
}
