package com.braindump.orchestrator.service;

import com.braindump.orchestrator.error.GitException;
import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.git.BranchNames;
import com.braindump.orchestrator.git.CommandResult;
import com.braindump.orchestrator.git.GitClient;
import com.braindump.orchestrator.git.WorktreeLayout;
import com.braindump.orchestrator.model.Epic;
import com.braindump.orchestrator.model.EpicWorkflowState;
import com.braindump.orchestrator.model.IsolationMode;
import com.braindump.orchestrator.model.Ticket;
import com.braindump.orchestrator.repository.EpicWorkflowStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides which branch a ticket is worked on and makes git agree.
 *
 * Tickets outside an epic get their own branch. Tickets of an epic all share the
 * epic's branch; once recorded in {@link EpicWorkflowState} that name is
 * authoritative and is never silently replaced.
 *
 * Epic state changes are saved through the repository but not flushed; callers run
 * this inside the transaction that also writes the ticket, so both commit together.
 */
@Component
public class BranchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BranchCoordinator.class);

    /** Epic branch plus whatever had to be noticed while getting it ready. */
    public record EpicBranch(EpicWorkflowState state, BranchResolution resolution, List<String> warnings) {}

    private final GitClient                   git;
    private final EpicWorkflowStateRepository epicStateRepo;
    private final WorktreeLayout              worktreeLayout;

    public BranchCoordinator(GitClient git,
                             EpicWorkflowStateRepository epicStateRepo,
                             WorktreeLayout worktreeLayout) {
        this.git            = git;
        this.epicStateRepo  = epicStateRepo;
        this.worktreeLayout = worktreeLayout;
    }

    // ------------------------------------------------------------------
    // Ticket branches
    // ------------------------------------------------------------------

    /**
     * Puts the working tree on the branch for {@code ticket}, creating it if needed.
     *
     * @throws GitException       if a git command fails
     * @throws WorkflowException  EPIC_BRANCH_MISSING when the epic's recorded branch is gone
     */
    public BranchResolution resolveBranch(Ticket ticket, Path projectPath) {
        String previousRef = git.currentRef(projectPath).orElse(null);
        Epic epic = ticket.getEpic();
        if (epic == null) {
            return resolveStandaloneBranch(ticket, projectPath, previousRef);
        }

        EpicWorkflowState state = epicStateRepo.findByEpicId(epic.getId())
                .orElseGet(() -> new EpicWorkflowState(epic.getId()));

        BranchResolution resolution;
        if (state.getEpicBranchName() != null) {
            resolution = checkoutRecordedEpicBranch(epic, state, projectPath, previousRef);
        } else {
            resolution = createEpicBranch(epic, state, projectPath, previousRef);
        }
        state.setCurrentTicketId(ticket.getId());
        epicStateRepo.save(state);
        return resolution;
    }

    private BranchResolution resolveStandaloneBranch(Ticket ticket, Path projectPath, String previousRef) {
        String branch = BranchNames.ticketBranch(ticket.getId(), ticket.getTitle());
        if (git.branchExists(projectPath, branch)) {
            require(git.checkout(projectPath, branch), "checkout " + branch);
            log.info("Checked out existing branch {}", branch);
            return new BranchResolution(branch, false, false, projectPath, false, previousRef);
        }
        require(git.createBranch(projectPath, branch), "create branch " + branch);
        log.info("Created branch {} from {}", branch, previousRef);
        return new BranchResolution(branch, true, false, projectPath, false, previousRef);
    }

    private BranchResolution checkoutRecordedEpicBranch(Epic epic, EpicWorkflowState state,
                                                        Path projectPath, String previousRef) {
        String branch = state.getEpicBranchName();
        Path workDir  = state.workingDirectory(projectPath);
        if (state.getWorktreePath() != null && !Files.isDirectory(workDir)) {
            throw WorkflowException.epicBranchMissing(epic.getId(), branch,
                    "has a recorded worktree at " + workDir + " that no longer exists");
        }
        if (!git.branchExists(projectPath, branch)) {
            throw WorkflowException.epicBranchMissing(epic.getId(), branch,
                    "is recorded for the epic but no longer exists in the repository");
        }
        require(git.checkout(workDir, branch), "checkout " + branch);
        log.info("Using epic branch {} in {}", branch, workDir);
        return new BranchResolution(branch, false, true, workDir, false, previousRef);
    }

    // ------------------------------------------------------------------
    // Epic branches
    // ------------------------------------------------------------------

    /**
     * Makes sure the epic's branch exists and is checked out. A recorded branch that
     * was deleted out of band is recreated from trunk, with warnings. A recorded
     * worktree whose directory is gone gets the existing branch checked out again.
     */
    public EpicBranch initializeEpicBranch(Epic epic, Path projectPath) {
        String previousRef = git.currentRef(projectPath).orElse(null);
        EpicWorkflowState state = epicStateRepo.findByEpicId(epic.getId())
                .orElseGet(() -> new EpicWorkflowState(epic.getId()));
        List<String> warnings = new ArrayList<>();

        String recorded = state.getEpicBranchName();
        if (recorded != null) {
            Path workDir = state.workingDirectory(projectPath);
            boolean worktreeOk = state.getWorktreePath() == null || Files.isDirectory(workDir);
            boolean branchOk   = git.branchExists(projectPath, recorded);
            if (worktreeOk && branchOk) {
                require(git.checkout(workDir, recorded), "checkout " + recorded);
                return new EpicBranch(state,
                        new BranchResolution(recorded, false, true, workDir, false, previousRef),
                        warnings);
            }
            if (state.getWorktreePath() != null) {
                CommandResult prune = git.pruneWorktrees(projectPath);
                if (!prune.success()) {
                    warnings.add("git worktree prune failed: " + prune.error());
                }
            }

            if (branchOk) {
                // Only the worktree directory is gone; the branch and its commits are intact.
                Path worktree = worktreeLayout.worktreePathFor(projectPath, epic);
                log.warn("Worktree {} of epic branch {} is missing; re-attaching at {}", workDir, recorded, worktree);
                require(git.addWorktree(projectPath, worktree, recorded), "add worktree " + worktree);
                state.recordBranch(recorded, worktree);
                epicStateRepo.save(state);
                warnings.add("Worktree %s of epic branch '%s' no longer existed; the existing branch was checked out in %s."
                        .formatted(workDir, recorded, worktree));
                return new EpicBranch(state,
                        new BranchResolution(recorded, false, true, worktree, true, previousRef),
                        warnings);
            }

            log.warn("Epic branch {} is missing; re-initialising", recorded);
            warnings.add("Epic branch '%s' no longer existed and was recreated from trunk."
                    .formatted(recorded));
            if (state.getPrNumber() != null) {
                warnings.add(("Pull request #%d was opened for the previous '%s' branch; "
                        + "check that it still points at the right commits.")
                        .formatted(state.getPrNumber(), recorded));
            }
        }

        BranchResolution resolution = createEpicBranch(epic, state, projectPath, previousRef);
        epicStateRepo.save(state);
        return new EpicBranch(state, resolution, warnings);
    }

    private BranchResolution createEpicBranch(Epic epic, EpicWorkflowState state,
                                              Path projectPath, String previousRef) {
        String branch = BranchNames.epicBranch(epic.getId(), epic.getTitle());
        boolean exists = git.branchExists(projectPath, branch);

        if (epic.getIsolationMode() == IsolationMode.WORKTREE) {
            Path worktree = worktreeLayout.worktreePathFor(projectPath, epic);
            if (Files.isDirectory(worktree) && exists) {
                require(git.checkout(worktree, branch), "checkout " + branch);
                state.recordBranch(branch, worktree);
                return new BranchResolution(branch, false, true, worktree, false, previousRef);
            }
            if (exists) {
                require(git.addWorktree(projectPath, worktree, branch), "add worktree " + worktree);
            } else {
                String trunk = git.findTrunkBranch(projectPath);
                require(git.addWorktreeWithNewBranch(projectPath, worktree, branch, trunk),
                        "add worktree " + worktree);
            }
            state.recordBranch(branch, worktree);
            log.info("Epic branch {} checked out in worktree {} (new branch: {})", branch, worktree, !exists);
            return new BranchResolution(branch, !exists, true, worktree, true, previousRef);
        }

        if (exists) {
            require(git.checkout(projectPath, branch), "checkout " + branch);
            state.recordBranch(branch, null);
            return new BranchResolution(branch, false, true, projectPath, false, previousRef);
        }
        String trunk = git.findTrunkBranch(projectPath);
        require(git.checkout(projectPath, trunk), "checkout " + trunk);
        CommandResult create = git.createBranch(projectPath, branch);
        if (!create.success()) {
            throw restoreAndFail(projectPath, previousRef, trunk, "create branch " + branch, create);
        }
        state.recordBranch(branch, null);
        log.info("Created epic branch {} from {}", branch, trunk);
        return new BranchResolution(branch, true, true, projectPath, false, previousRef);
    }

    // ------------------------------------------------------------------
    // Compensation
    // ------------------------------------------------------------------

    /**
     * Undoes what {@code resolution} created after the record store refused the write.
     * Each step runs and is checked on its own; failures come back as messages.
     * Reused branches are never touched.
     */
    public List<String> rollback(BranchResolution resolution, Path projectPath) {
        List<String> problems = new ArrayList<>();
        if (!resolution.created() && !resolution.worktreeCreated()) {
            return problems;
        }

        if (resolution.worktreeCreated()) {
            CommandResult remove = git.removeWorktree(projectPath, resolution.workingDirectory());
            if (!remove.success()) {
                problems.add("Could not remove worktree %s: %s"
                        .formatted(resolution.workingDirectory(), remove.error()));
            }
        } else if (resolution.previousRef() != null) {
            CommandResult checkout = git.checkout(projectPath, resolution.previousRef());
            if (!checkout.success()) {
                problems.add("Could not check out previous branch %s: %s"
                        .formatted(resolution.previousRef(), checkout.error()));
            }
        } else {
            problems.add("Previous branch unknown; HEAD left on " + resolution.branchName());
        }

        if (resolution.created()) {
            CommandResult delete = git.deleteBranch(projectPath, resolution.branchName());
            if (!delete.success()) {
                problems.add("Could not delete branch %s: %s"
                        .formatted(resolution.branchName(), delete.error()));
            }
        }

        if (problems.isEmpty()) {
            log.info("Rolled back branch {}", resolution.branchName());
        } else {
            problems.forEach(p -> log.error("Rollback of {}: {}", resolution.branchName(), p));
        }
        return problems;
    }

    /** Puts HEAD back where the caller had it before reporting {@code failed}. */
    private GitException restoreAndFail(Path projectPath, String previousRef, String currentRef,
                                        String action, CommandResult failed) {
        if (previousRef == null || previousRef.equals(currentRef)) {
            return GitException.from(action, failed);
        }
        CommandResult restore = git.checkout(projectPath, previousRef);
        if (restore.success()) {
            return GitException.from(action, failed);
        }
        String problem = "Could not check out previous branch %s: %s".formatted(previousRef, restore.error());
        log.error("After failed {}: {}", action, problem);
        return new GitException(action, failed.command(), failed.error(), Map.of("restoreWarning", problem));
    }

    private static void require(CommandResult result, String action) {
        if (!result.success()) {
            throw GitException.from(action, result);
        }
    }
}
