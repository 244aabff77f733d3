package com.braindump.orchestrator.service;

import com.braindump.orchestrator.error.GitException;
import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.git.CommandResult;
import com.braindump.orchestrator.git.GitClient;
import com.braindump.orchestrator.git.PullRequestClient;
import com.braindump.orchestrator.git.PullRequestClient.PullRequest;
import com.braindump.orchestrator.model.*;
import com.braindump.orchestrator.repository.EpicRepository;
import com.braindump.orchestrator.repository.EpicWorkflowStateRepository;
import com.braindump.orchestrator.repository.TicketRepository;
import com.braindump.orchestrator.repository.TicketWorkflowStateRepository;
import com.braindump.orchestrator.service.result.*;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ticket and epic lifecycle: start work, complete work, start epic work and the
 * review fix loop.
 *
 * Every operation writes in a fixed order:
 * <ol>
 *   <li>git (branch checkout / creation)</li>
 *   <li>primary write: ticket status and branch, epic branch record. One transaction.
 *       If it fails, anything git created in step 1 is undone and the call fails.</li>
 *   <li>secondary write: {@link TicketWorkflowState}. Its own transaction; a failure
 *       only adds a warning to the result.</li>
 * </ol>
 *
 * This service never moves a ticket to DONE.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    static final String OPERATIONS_METRIC = "braindump.workflow.operations";

    private final TicketRepository              ticketRepo;
    private final EpicRepository                epicRepo;
    private final EpicWorkflowStateRepository   epicStateRepo;
    private final TicketWorkflowStateRepository workflowStateRepo;
    private final BranchCoordinator             branchCoordinator;
    private final GitClient                     git;
    private final PullRequestClient             pullRequests;
    private final TransactionOperations         tx;
    private final MeterRegistry                 meterRegistry;

    public WorkflowService(TicketRepository ticketRepo,
                           EpicRepository epicRepo,
                           EpicWorkflowStateRepository epicStateRepo,
                           TicketWorkflowStateRepository workflowStateRepo,
                           BranchCoordinator branchCoordinator,
                           GitClient git,
                           PullRequestClient pullRequests,
                           TransactionOperations tx,
                           MeterRegistry meterRegistry) {
        this.ticketRepo        = ticketRepo;
        this.epicRepo          = epicRepo;
        this.epicStateRepo     = epicStateRepo;
        this.workflowStateRepo = workflowStateRepo;
        this.branchCoordinator = branchCoordinator;
        this.git               = git;
        this.pullRequests      = pullRequests;
        this.tx                = tx;
        this.meterRegistry     = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Start work
    // ------------------------------------------------------------------

    /**
     * Moves a ticket to IN_PROGRESS on its branch.
     *
     * Starting a ticket that is already in progress changes nothing and succeeds.
     * Restarting from AI_REVIEW or HUMAN_REVIEW resets the review counters.
     */
    public StartWorkResult startWork(UUID ticketId) {
        MDC.put("operation", "start_work");
        MDC.put("ticketId", ticketId.toString());
        try {
            Ticket ticket = ticketRepo.findById(ticketId)
                    .orElseThrow(() -> WorkflowException.ticketNotFound(ticketId));

            if (ticket.getStatus() == TicketStatus.IN_PROGRESS) {
                log.info("Ticket {} already in progress on {}", ticketId, ticket.getBranchName());
                count("start_work", "already_started");
                return new StartWorkResult(TicketSnapshot.from(ticket), ticket.getBranchName(),
                        false, ticket.getEpic() != null, null, null, true, List.of());
            }
            requireTransition(ticket, TicketStatus.IN_PROGRESS, "start work");

            Path projectPath = requireRepository(ticket.getProject());
            if (ticket.getEpic() != null) {
                MDC.put("epicId", ticket.getEpic().getId().toString());
            }

            AtomicReference<BranchResolution> resolved = new AtomicReference<>();
            Ticket saved;
            try {
                saved = tx.execute(status -> {
                    BranchResolution resolution = branchCoordinator.resolveBranch(ticket, projectPath);
                    resolved.set(resolution);
                    ticket.transitionTo(TicketStatus.IN_PROGRESS);
                    ticket.setBranchName(resolution.branchName());
                    return ticketRepo.saveAndFlush(ticket);
                });
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw primaryWriteFailed("start work", e, resolved.get(), projectPath);
            }

            BranchResolution resolution = resolved.get();
            List<String> warnings = new ArrayList<>();
            try {
                tx.executeWithoutResult(status -> resetWorkflowState(ticketId));
            } catch (RuntimeException e) {
                log.warn("Workflow state for ticket {} not updated: {}", ticketId, e.getMessage());
                warnings.add("Workflow state tracking could not be updated: " + e.getMessage());
            }

            log.info("Ticket {} -> in_progress on {} (created: {})",
                    ticketId, resolution.branchName(), resolution.created());
            count("start_work", "success");
            return new StartWorkResult(
                    TicketSnapshot.from(saved),
                    resolution.branchName(),
                    resolution.created(),
                    resolution.usingEpicBranch(),
                    resolution.usingEpicBranch() ? resolution.branchName() : null,
                    resolution.workingDirectory().toString(),
                    false,
                    warnings);
        } catch (WorkflowException e) {
            count("start_work", e.getKind().name().toLowerCase());
            throw e;
        } finally {
            clearMdc();
        }
    }

    private void resetWorkflowState(UUID ticketId) {
        TicketWorkflowState state = workflowStateRepo.findByTicketId(ticketId)
                .map(existing -> {
                    existing.resetForImplementation();
                    return existing;
                })
                .orElseGet(() -> new TicketWorkflowState(ticketId, WorkflowPhase.IMPLEMENTATION, 0));
        workflowStateRepo.save(state);
    }

    // ------------------------------------------------------------------
    // Complete work
    // ------------------------------------------------------------------

    /**
     * Hands an in-progress ticket over to AI review.
     *
     * Commits and changed files are collected for the report only; if git cannot
     * provide them the ticket still moves on.
     */
    public CompleteWorkResult completeWork(UUID ticketId, String summary) {
        MDC.put("operation", "complete_work");
        MDC.put("ticketId", ticketId.toString());
        try {
            Ticket ticket = ticketRepo.findById(ticketId)
                    .orElseThrow(() -> WorkflowException.ticketNotFound(ticketId));

            switch (ticket.getStatus()) {
                case DONE, AI_REVIEW, HUMAN_REVIEW -> {
                    log.info("Ticket {} already {}; nothing to complete", ticketId, ticket.getStatus().value());
                    count("complete_work", "unchanged");
                    return CompleteWorkResult.unchanged(TicketSnapshot.from(ticket), summary);
                }
                case BACKLOG, READY -> throw WorkflowException.invalidState("ticket",
                        ticket.getStatus().value(), TicketStatus.IN_PROGRESS.value(), "complete work");
                default -> { }
            }

            List<String> warnings = new ArrayList<>();
            List<String> commits  = new ArrayList<>();
            List<String> files    = new ArrayList<>();
            collectWorkReport(ticket, commits, files, warnings);

            Ticket saved;
            try {
                saved = tx.execute(status -> {
                    ticket.transitionTo(TicketStatus.AI_REVIEW);
                    return ticketRepo.saveAndFlush(ticket);
                });
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw primaryWriteFailed("complete work", e, null, null);
            }

            Integer iteration = null;
            try {
                iteration = tx.execute(status -> enterAiReview(ticketId));
            } catch (RuntimeException e) {
                log.warn("Review iteration for ticket {} not recorded: {}", ticketId, e.getMessage());
                warnings.add("Review iteration could not be recorded: " + e.getMessage());
            }

            TicketRef next = null;
            try {
                next = suggestNextTicket(saved).orElse(null);
            } catch (DataAccessException e) {
                warnings.add("Could not look up the next ticket: " + e.getMessage());
            }

            log.info("Ticket {} -> ai_review (iteration {}, {} commits)", ticketId, iteration, commits.size());
            count("complete_work", "success");
            return new CompleteWorkResult(TicketSnapshot.from(saved), saved.getStatus(), true, iteration,
                    summary, commits, files, NextAction.forStatus(saved.getStatus()), next, warnings);
        } catch (WorkflowException e) {
            count("complete_work", e.getKind().name().toLowerCase());
            throw e;
        } finally {
            clearMdc();
        }
    }

    private Integer enterAiReview(UUID ticketId) {
        TicketWorkflowState state = workflowStateRepo.findByTicketId(ticketId)
                .map(existing -> {
                    existing.enterAiReview();
                    return existing;
                })
                .orElseGet(() -> new TicketWorkflowState(ticketId, WorkflowPhase.AI_REVIEW, 1));
        return workflowStateRepo.save(state).getReviewIteration();
    }

    private void collectWorkReport(Ticket ticket, List<String> commits, List<String> files,
                                   List<String> warnings) {
        Path workDir;
        try {
            workDir = workingDirectoryOf(ticket);
        } catch (WorkflowException e) {
            warnings.add("Commit summary unavailable: " + e.getMessage());
            return;
        }
        String trunk = git.findTrunkBranch(workDir);

        CommandResult history = git.commitsSince(workDir, trunk);
        if (!history.success()) {
            history = git.recentCommits(workDir);
        }
        if (history.success()) {
            commits.addAll(history.lines());
        } else {
            warnings.add("Could not list commits: " + history.error());
        }

        CommandResult diff = git.changedFilesSince(workDir, trunk);
        if (diff.success()) {
            files.addAll(diff.lines());
        } else {
            warnings.add("Could not list changed files: " + diff.error());
        }
    }

    /** Same project, other ticket: first READY by position, else first BACKLOG. */
    private Optional<TicketRef> suggestNextTicket(Ticket completed) {
        UUID projectId = completed.getProject().getId();
        return ticketRepo.findFirstByProject_IdAndIdNotAndStatusOrderByPositionAsc(
                        projectId, completed.getId(), TicketStatus.READY)
                .or(() -> ticketRepo.findFirstByProject_IdAndIdNotAndStatusOrderByPositionAsc(
                        projectId, completed.getId(), TicketStatus.BACKLOG))
                .map(TicketRef::from);
    }

    // ------------------------------------------------------------------
    // Review fix loop
    // ------------------------------------------------------------------

    /**
     * Sends a ticket in AI review back to implementation so findings can be fixed.
     * The review iteration is kept; the next {@link #completeWork} bumps it.
     */
    public TransitionResult returnToImplementation(UUID ticketId) {
        MDC.put("operation", "return_to_implementation");
        MDC.put("ticketId", ticketId.toString());
        try {
            Ticket ticket = ticketRepo.findById(ticketId)
                    .orElseThrow(() -> WorkflowException.ticketNotFound(ticketId));
            if (ticket.getStatus() == TicketStatus.IN_PROGRESS) {
                count("return_to_implementation", "unchanged");
                return new TransitionResult(TicketSnapshot.from(ticket), false, List.of());
            }
            if (ticket.getStatus() != TicketStatus.AI_REVIEW) {
                throw WorkflowException.invalidState("ticket", ticket.getStatus().value(),
                        TicketStatus.AI_REVIEW.value(), "return to implementation");
            }

            Ticket saved;
            try {
                saved = tx.execute(status -> {
                    ticket.transitionTo(TicketStatus.IN_PROGRESS);
                    return ticketRepo.saveAndFlush(ticket);
                });
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw primaryWriteFailed("return to implementation", e, null, null);
            }

            List<String> warnings = new ArrayList<>();
            try {
                tx.executeWithoutResult(status -> workflowStateRepo.findByTicketId(ticketId)
                        .ifPresent(state -> {
                            state.returnToImplementation();
                            workflowStateRepo.save(state);
                        }));
            } catch (RuntimeException e) {
                log.warn("Workflow phase for ticket {} not updated: {}", ticketId, e.getMessage());
                warnings.add("Workflow phase could not be updated: " + e.getMessage());
            }

            log.info("Ticket {} back to in_progress for fixes", ticketId);
            count("return_to_implementation", "success");
            return new TransitionResult(TicketSnapshot.from(saved), true, warnings);
        } catch (WorkflowException e) {
            count("return_to_implementation", e.getKind().name().toLowerCase());
            throw e;
        } finally {
            clearMdc();
        }
    }

    // ------------------------------------------------------------------
    // Start epic work
    // ------------------------------------------------------------------

    /**
     * Prepares an epic's shared branch (or worktree) and records it.
     * With {@code createPr}, the branch is pushed and a draft pull request opened;
     * that part is best effort and only ever adds warnings.
     */
    public StartEpicWorkResult startEpicWork(UUID epicId, boolean createPr) {
        MDC.put("operation", "start_epic_work");
        MDC.put("epicId", epicId.toString());
        try {
            Epic epic = epicRepo.findById(epicId)
                    .orElseThrow(() -> WorkflowException.epicNotFound(epicId));
            Path projectPath = requireRepository(epic.getProject());

            List<String> warnings = new ArrayList<>();
            AtomicReference<BranchResolution> resolved = new AtomicReference<>();
            EpicWorkflowState state;
            try {
                state = tx.execute(status -> {
                    BranchCoordinator.EpicBranch branch = branchCoordinator.initializeEpicBranch(epic, projectPath);
                    resolved.set(branch.resolution());
                    warnings.addAll(branch.warnings());
                    EpicWorkflowState s = branch.state();
                    s.updateProgress(
                            (int) ticketRepo.countByEpic_Id(epicId),
                            (int) ticketRepo.countByEpic_IdAndStatus(epicId, TicketStatus.DONE));
                    return epicStateRepo.saveAndFlush(s);
                });
            } catch (DataAccessException | PersistenceException | TransactionException e) {
                throw primaryWriteFailed("start epic work", e, resolved.get(), projectPath);
            }

            BranchResolution resolution = resolved.get();
            if (createPr) {
                state = openDraftPullRequest(epic, state, resolution.workingDirectory(), warnings);
            }

            List<TicketRef> tickets = ticketRepo.findByEpic_IdOrderByPositionAsc(epicId).stream()
                    .map(TicketRef::from)
                    .toList();

            log.info("Epic {} on {} ({} / {} tickets done)", epicId, resolution.branchName(),
                    state.getTicketsDone(), state.getTicketsTotal());
            count("start_epic_work", "success");
            return new StartEpicWorkResult(epicId, epic.getTitle(), resolution.branchName(),
                    resolution.created(), resolution.workingDirectory().toString(),
                    state.getPrNumber(), state.getPrUrl(), state.getPrStatus(),
                    state.getTicketsTotal(), state.getTicketsDone(), tickets, warnings);
        } catch (WorkflowException e) {
            count("start_epic_work", e.getKind().name().toLowerCase());
            throw e;
        } finally {
            clearMdc();
        }
    }

    private EpicWorkflowState openDraftPullRequest(Epic epic, EpicWorkflowState state, Path workDir,
                                                   List<String> warnings) {
        if (state.getPrNumber() != null) {
            warnings.add("Pull request #%d already recorded; not creating another.".formatted(state.getPrNumber()));
            return state;
        }
        String branch = state.getEpicBranchName();
        CommandResult push = git.push(workDir, branch);
        if (!push.success()) {
            log.warn("Push of {} failed: {}", branch, push.error());
            warnings.add("Could not push %s: %s".formatted(branch, push.error()));
            return state;
        }

        PullRequest pr = pullRequests.createDraft(workDir, "[Epic] " + epic.getTitle(),
                "Epic work for: " + epic.getTitle() + "\n\nThis PR contains all tickets from the epic.");
        if (!pr.created()) {
            warnings.add("Could not create draft pull request: " + pr.error());
            return state;
        }
        if (pr.number() == null) {
            warnings.add("Draft pull request created at " + pr.url() + " but its number could not be read.");
            return state;
        }

        try {
            return tx.execute(status -> {
                EpicWorkflowState current = epicStateRepo.findByEpicId(epic.getId()).orElse(state);
                current.recordPullRequest(pr.number(), pr.url(), PrStatus.DRAFT);
                return epicStateRepo.save(current);
            });
        } catch (RuntimeException e) {
            log.warn("Draft PR {} created but not recorded: {}", pr.url(), e.getMessage());
            warnings.add("Draft pull request %s was created but could not be recorded: %s"
                    .formatted(pr.url(), e.getMessage()));
            return state;
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static void requireTransition(Ticket ticket, TicketStatus next, String action) {
        if (!ticket.getStatus().canTransitionTo(next)) {
            throw WorkflowException.invalidState("ticket", ticket.getStatus().value(), next.value(), action);
        }
    }

    private Path requireRepository(Project project) {
        Path path = requireProjectPath(project);
        if (!git.isRepository(path)) {
            throw new GitException("not a git repository: " + path, "git rev-parse --git-dir",
                    "fatal: not a git repository");
        }
        return path;
    }

    private static Path requireProjectPath(Project project) {
        String raw = project.getPath();
        if (raw == null || raw.isBlank() || !Files.isDirectory(Path.of(raw))) {
            throw WorkflowException.pathNotFound(raw);
        }
        return Path.of(raw);
    }

    /** Directory the ticket's branch is checked out in: the epic worktree, if any. */
    private Path workingDirectoryOf(Ticket ticket) {
        Path projectPath = requireProjectPath(ticket.getProject());
        if (ticket.getEpic() == null) {
            return projectPath;
        }
        return epicStateRepo.findByEpicId(ticket.getEpic().getId())
                .map(state -> state.workingDirectory(projectPath))
                .filter(Files::isDirectory)
                .orElse(projectPath);
    }

    private WorkflowException primaryWriteFailed(String action, RuntimeException cause,
                                                 BranchResolution resolution, Path projectPath) {
        List<String> rollbackProblems = resolution == null
                ? List.of()
                : branchCoordinator.rollback(resolution, projectPath);
        log.error("Failed to {}: {}", action, cause.getMessage(), cause);
        return WorkflowException.primaryPersistenceFailure(action, cause, rollbackProblems);
    }

    private void count(String operation, String outcome) {
        meterRegistry.counter(OPERATIONS_METRIC, "operation", operation, "outcome", outcome).increment();
    }

    private static void clearMdc() {
        MDC.remove("operation");
        MDC.remove("ticketId");
        MDC.remove("epicId");
    }
}
