package com.braindump.orchestrator.service;

import com.braindump.orchestrator.TestEntities;
import com.braindump.orchestrator.error.GitException;
import com.braindump.orchestrator.error.WorkflowException;
import com.braindump.orchestrator.git.FakeGitRunner;
import com.braindump.orchestrator.git.GitClient;
import com.braindump.orchestrator.git.WorktreeLayout;
import com.braindump.orchestrator.model.*;
import com.braindump.orchestrator.repository.EpicWorkflowStateRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * BranchCoordinator against an in-memory git. The epic state repository is mocked.
 */
@ExtendWith(MockitoExtension.class)
class BranchCoordinatorTest {

    @TempDir Path workspace;

    @Mock EpicWorkflowStateRepository epicStateRepo;

    Path projectPath;
    Project project;

    @BeforeEach
    void setUp() throws IOException {
        projectPath = Files.createDirectory(workspace.resolve("app"));
        project     = TestEntities.project(projectPath.toString());
    }

    private BranchCoordinator coordinator(FakeGitRunner runner) {
        GitClient git = new GitClient(runner, "git", 30, 120, new SimpleMeterRegistry());
        return new BranchCoordinator(git, epicStateRepo, new WorktreeLayout("sibling"));
    }

    // ------------------------------------------------------------------
    // Standalone tickets
    // ------------------------------------------------------------------

    @Test
    void standaloneTicket_newBranch_createdFromCurrentHead() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "develop", "main");
        Ticket ticket = TestEntities.ticket(project, null, "Add login form", TicketStatus.READY);

        BranchResolution r = coordinator(runner).resolveBranch(ticket, projectPath);

        assertThat(r.branchName()).isEqualTo("feature/" + ticket.getId().toString().substring(0, 8) + "-add-login-form");
        assertThat(r.created()).isTrue();
        assertThat(r.usingEpicBranch()).isFalse();
        assertThat(r.previousRef()).isEqualTo("develop");
        assertThat(runner.heads.get(projectPath)).isEqualTo(r.branchName());
        assertThat(runner.ran("checkout main")).isFalse();   // not rebased onto trunk
        verifyNoInteractions(epicStateRepo);
    }

    @Test
    void standaloneTicket_sameTicketTwice_reusesSameBranch() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main");
        Ticket ticket = TestEntities.ticket(project, null, "Refactor parser", TicketStatus.BACKLOG);
        BranchCoordinator coordinator = coordinator(runner);

        BranchResolution first  = coordinator.resolveBranch(ticket, projectPath);
        BranchResolution second = coordinator.resolveBranch(ticket, projectPath);

        assertThat(second.branchName()).isEqualTo(first.branchName());
        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
    }

    // ------------------------------------------------------------------
    // Epic tickets
    // ------------------------------------------------------------------

    @Test
    void epicTicket_noRecordedBranch_createsEpicBranchFromMain() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "develop", "master", "main");
        Epic epic = TestEntities.epic(project, "User Auth", IsolationMode.SHARED_BRANCH);
        Ticket ticket = TestEntities.ticket(project, epic, "Login form", TicketStatus.READY);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.empty());

        BranchResolution r = coordinator(runner).resolveBranch(ticket, projectPath);

        String expected = "feature/epic-" + epic.getId().toString().substring(0, 8) + "-user-auth";
        assertThat(r.branchName()).isEqualTo(expected);
        assertThat(r.created()).isTrue();
        assertThat(r.usingEpicBranch()).isTrue();
        assertThat(runner.ran("checkout main")).isTrue();
        assertThat(runner.ran("checkout master")).isFalse();

        ArgumentCaptor<EpicWorkflowState> saved = ArgumentCaptor.forClass(EpicWorkflowState.class);
        verify(epicStateRepo).save(saved.capture());
        assertThat(saved.getValue().getEpicBranchName()).isEqualTo(expected);
        assertThat(saved.getValue().getCurrentTicketId()).isEqualTo(ticket.getId());
    }

    @Test
    void epicTickets_shareTheRecordedBranch() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main", "feature/epic-shared");
        Epic epic = TestEntities.epic(project, "User Auth", IsolationMode.SHARED_BRANCH);
        EpicWorkflowState state = new EpicWorkflowState(epic.getId());
        state.recordBranch("feature/epic-shared", null);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.of(state));
        BranchCoordinator coordinator = coordinator(runner);

        BranchResolution a = coordinator.resolveBranch(
                TestEntities.ticket(project, epic, "Login form", TicketStatus.READY), projectPath);
        Ticket second = TestEntities.ticket(project, epic, "Logout button", TicketStatus.READY);
        BranchResolution b = coordinator.resolveBranch(second, projectPath);

        assertThat(a.branchName()).isEqualTo("feature/epic-shared");
        assertThat(b.branchName()).isEqualTo("feature/epic-shared");
        assertThat(a.created()).isFalse();
        assertThat(state.getCurrentTicketId()).isEqualTo(second.getId());
        assertThat(runner.ran("checkout -b")).isFalse();
    }

    @Test
    void epicTicket_recordedBranchDeleted_reportsInconsistency() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main");
        Epic epic = TestEntities.epic(project, "User Auth", IsolationMode.SHARED_BRANCH);
        EpicWorkflowState state = new EpicWorkflowState(epic.getId());
        state.recordBranch("feature/epic-gone", null);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.of(state));
        Ticket ticket = TestEntities.ticket(project, epic, "Login form", TicketStatus.READY);

        assertThatThrownBy(() -> coordinator(runner).resolveBranch(ticket, projectPath))
                .isInstanceOf(WorkflowException.class)
                .satisfies(e -> {
                    WorkflowException we = (WorkflowException) e;
                    assertThat(we.getKind()).isEqualTo(WorkflowException.Kind.PRECONDITION_VIOLATED);
                    assertThat(we.getCode()).isEqualTo("EPIC_BRANCH_MISSING");
                });
        assertThat(runner.ran("checkout -b")).isFalse();
        assertThat(runner.branches).containsExactly("main");
        verify(epicStateRepo, never()).save(any());
    }

    @Test
    void worktreeEpic_createsWorktreeNextToProject() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main");
        Epic epic = TestEntities.epic(project, "Payments", IsolationMode.WORKTREE);
        Ticket ticket = TestEntities.ticket(project, epic, "Card form", TicketStatus.READY);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.empty());

        BranchResolution r = coordinator(runner).resolveBranch(ticket, projectPath);

        Path expected = workspace.resolve("app-epic-" + epic.getId().toString().substring(0, 8) + "-payments");
        assertThat(r.workingDirectory()).isEqualTo(expected);
        assertThat(r.worktreeCreated()).isTrue();
        assertThat(r.created()).isTrue();
        assertThat(Files.isDirectory(expected)).isTrue();
        assertThat(runner.heads.get(projectPath)).isEqualTo("main");   // main tree untouched
        assertThat(runner.executed).contains(
                List.of("git", "worktree", "add", "-b", r.branchName(), expected.toString(), "main"));
    }

    @Test
    void worktreeEpic_recordedWorktreeMissing_reportsInconsistency() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main", "feature/epic-pay");
        Epic epic = TestEntities.epic(project, "Payments", IsolationMode.WORKTREE);
        EpicWorkflowState state = new EpicWorkflowState(epic.getId());
        state.recordBranch("feature/epic-pay", workspace.resolve("deleted-worktree"));
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.of(state));
        Ticket ticket = TestEntities.ticket(project, epic, "Card form", TicketStatus.READY);

        assertThatThrownBy(() -> coordinator(runner).resolveBranch(ticket, projectPath))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("feature/epic-pay");
    }

    @Test
    void gitFailure_surfacesStderr() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main").failOn("checkout -b");
        Ticket ticket = TestEntities.ticket(project, null, "Add login form", TicketStatus.READY);

        assertThatThrownBy(() -> coordinator(runner).resolveBranch(ticket, projectPath))
                .isInstanceOf(GitException.class)
                .hasMessageContaining("simulated failure");
    }

    @Test
    void epicBranchCreateFails_headRestoredToPreviousBranch() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "develop", "main").failOn("checkout -b");
        Epic epic = TestEntities.epic(project, "User Auth", IsolationMode.SHARED_BRANCH);
        Ticket ticket = TestEntities.ticket(project, epic, "Login form", TicketStatus.READY);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator(runner).resolveBranch(ticket, projectPath))
                .isInstanceOf(GitException.class)
                .satisfies(e -> assertThat(((GitException) e).getDetails()).doesNotContainKey("restoreWarning"));
        assertThat(runner.heads.get(projectPath)).isEqualTo("develop");
        verify(epicStateRepo, never()).save(any());
    }

    @Test
    void epicBranchCreateFails_restoreFailureReportedInDetails() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "develop", "main")
                .failOn("checkout -b")
                .failOn("checkout develop");
        Epic epic = TestEntities.epic(project, "User Auth", IsolationMode.SHARED_BRANCH);
        Ticket ticket = TestEntities.ticket(project, epic, "Login form", TicketStatus.READY);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator(runner).resolveBranch(ticket, projectPath))
                .isInstanceOf(GitException.class)
                .satisfies(e -> assertThat(((GitException) e).getDetails().get("restoreWarning"))
                        .asString().contains("Could not check out previous branch develop"));
        assertThat(runner.heads.get(projectPath)).isEqualTo("main");
    }

    // ------------------------------------------------------------------
    // initializeEpicBranch
    // ------------------------------------------------------------------

    @Test
    void initializeEpicBranch_deletedBranch_recreatedWithWarningsAndPrKept() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main");
        Epic epic = TestEntities.epic(project, "User Auth", IsolationMode.SHARED_BRANCH);
        EpicWorkflowState state = new EpicWorkflowState(epic.getId());
        state.recordBranch("feature/epic-old", null);
        state.recordPullRequest(12, "https://github.com/acme/app/pull/12", PrStatus.DRAFT);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.of(state));

        BranchCoordinator.EpicBranch result = coordinator(runner).initializeEpicBranch(epic, projectPath);

        assertThat(result.resolution().created()).isTrue();
        assertThat(state.getEpicBranchName()).startsWith("feature/epic-");
        assertThat(state.getPrNumber()).isEqualTo(12);
        assertThat(result.warnings()).hasSize(2);
        assertThat(result.warnings().get(1)).contains("#12");
    }

    @Test
    void initializeEpicBranch_worktreeDeletedBranchKept_reattachesExistingBranch() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main", "feature/epic-pay");
        Epic epic = TestEntities.epic(project, "Payments", IsolationMode.WORKTREE);
        EpicWorkflowState state = new EpicWorkflowState(epic.getId());
        Path missing = workspace.resolve("deleted-worktree");
        state.recordBranch("feature/epic-pay", missing);
        when(epicStateRepo.findByEpicId(epic.getId())).thenReturn(Optional.of(state));

        BranchCoordinator.EpicBranch result = coordinator(runner).initializeEpicBranch(epic, projectPath);

        assertThat(result.resolution().branchName()).isEqualTo("feature/epic-pay");
        assertThat(result.resolution().created()).isFalse();
        assertThat(result.resolution().worktreeCreated()).isTrue();
        assertThat(Files.isDirectory(result.resolution().workingDirectory())).isTrue();
        assertThat(runner.branches).containsExactly("main", "feature/epic-pay");
        assertThat(runner.ran("worktree prune")).isTrue();
        assertThat(result.warnings()).singleElement().asString()
                .contains("Worktree " + missing)
                .contains("existing branch")
                .doesNotContain("recreated from trunk");
        verify(epicStateRepo).save(state);
    }

    // ------------------------------------------------------------------
    // rollback
    // ------------------------------------------------------------------

    @Test
    void rollback_createdBranch_restoresPreviousAndDeletes() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "develop");
        BranchCoordinator coordinator = coordinator(runner);
        Ticket ticket = TestEntities.ticket(project, null, "Add login form", TicketStatus.READY);
        BranchResolution r = coordinator.resolveBranch(ticket, projectPath);

        List<String> problems = coordinator.rollback(r, projectPath);

        assertThat(problems).isEmpty();
        assertThat(runner.heads.get(projectPath)).isEqualTo("develop");
        assertThat(runner.branches).containsExactly("develop");
    }

    @Test
    void rollback_deleteFails_checkoutStillDoneAndProblemReported() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "develop");
        BranchCoordinator coordinator = coordinator(runner);
        BranchResolution r = coordinator.resolveBranch(
                TestEntities.ticket(project, null, "Add login form", TicketStatus.READY), projectPath);
        runner.failOn("branch -D");

        List<String> problems = coordinator.rollback(r, projectPath);

        assertThat(runner.heads.get(projectPath)).isEqualTo("develop");
        assertThat(problems).singleElement().asString().contains("Could not delete branch");
    }

    @Test
    void rollback_reusedBranch_touchesNothing() {
        FakeGitRunner runner = new FakeGitRunner(projectPath, "main");
        BranchResolution reused = new BranchResolution("feature/x", false, false, projectPath, false, "main");

        List<String> problems = coordinator(runner).rollback(reused, projectPath);

        assertThat(problems).isEmpty();
        assertThat(runner.executed).isEmpty();
    }
}
