package com.braindump.orchestrator.git;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed wrapper around the git CLI.
 *
 * Every call goes through {@link CommandRunner} with an explicit argument list, so
 * branch names and paths are never shell-interpreted. Mutating calls return the
 * {@link CommandResult}; callers decide whether a failure is fatal.
 *
 * Each command is timed as {@code braindump.git.command.duration{command,status}}.
 */
@Component
public class GitClient {

    private static final Logger log = LoggerFactory.getLogger(GitClient.class);

    static final String DEFAULT_TRUNK = "main";

    private final CommandRunner runner;
    private final String        executable;
    private final Duration      commandTimeout;
    private final Duration      networkTimeout;
    private final MeterRegistry meterRegistry;

    public GitClient(
            CommandRunner runner,
            @Value("${braindump.git.executable:git}") String executable,
            @Value("${braindump.git.command-timeout-sec:30}") long commandTimeoutSec,
            @Value("${braindump.git.network-timeout-sec:120}") long networkTimeoutSec,
            MeterRegistry meterRegistry) {
        this.runner         = runner;
        this.executable     = executable;
        this.commandTimeout = Duration.ofSeconds(commandTimeoutSec);
        this.networkTimeout = Duration.ofSeconds(networkTimeoutSec);
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public boolean isRepository(Path dir) {
        return run(dir, "rev-parse", "--git-dir").success();
    }

    public boolean branchExists(Path dir, String branch) {
        return run(dir, "show-ref", "--verify", "--quiet", "refs/heads/" + branch).success();
    }

    /**
     * What HEAD currently points at: the branch name, or the commit id when detached.
     * Empty if neither can be read (e.g. a repository without commits).
     */
    public Optional<String> currentRef(Path dir) {
        CommandResult branch = run(dir, "symbolic-ref", "--quiet", "--short", "HEAD");
        if (branch.success() && !branch.output().isBlank()) {
            return Optional.of(branch.output());
        }
        CommandResult commit = run(dir, "rev-parse", "HEAD");
        if (commit.success() && !commit.output().isBlank()) {
            return Optional.of(commit.output());
        }
        return Optional.empty();
    }

    /** "main" if it exists, else "master", else "main". */
    public String findTrunkBranch(Path dir) {
        if (branchExists(dir, "main")) {
            return "main";
        }
        if (branchExists(dir, "master")) {
            return "master";
        }
        return DEFAULT_TRUNK;
    }

    /** One-line summaries of commits on HEAD that are not on {@code base}. */
    public CommandResult commitsSince(Path dir, String base) {
        return run(dir, "log", base + "..HEAD", "--oneline", "--no-decorate");
    }

    /** The last ten commits on HEAD; used when there is no trunk to compare against. */
    public CommandResult recentCommits(Path dir) {
        return run(dir, "log", "-10", "--oneline", "--no-decorate");
    }

    /** Names of files changed on HEAD relative to {@code base}. */
    public CommandResult changedFilesSince(Path dir, String base) {
        return run(dir, "diff", base + "..HEAD", "--name-only");
    }

    // ------------------------------------------------------------------
    // Branches
    // ------------------------------------------------------------------

    public CommandResult checkout(Path dir, String ref) {
        return run(dir, "checkout", ref);
    }

    /** Creates {@code branch} from the current HEAD and checks it out. */
    public CommandResult createBranch(Path dir, String branch) {
        return run(dir, "checkout", "-b", branch);
    }

    /**
     * Force-deletes a local branch. Only used to undo a branch this process just
     * created, which holds no commits of its own.
     */
    public CommandResult deleteBranch(Path dir, String branch) {
        return run(dir, "branch", "-D", branch);
    }

    // ------------------------------------------------------------------
    // Worktrees
    // ------------------------------------------------------------------

    /** Creates {@code branch} from {@code startPoint} and checks it out in a new worktree. */
    public CommandResult addWorktreeWithNewBranch(Path dir, Path worktree, String branch, String startPoint) {
        return run(dir, "worktree", "add", "-b", branch, worktree.toString(), startPoint);
    }

    /** Checks out an existing {@code branch} in a new worktree. */
    public CommandResult addWorktree(Path dir, Path worktree, String branch) {
        return run(dir, "worktree", "add", worktree.toString(), branch);
    }

    public CommandResult removeWorktree(Path dir, Path worktree) {
        return run(dir, "worktree", "remove", "--force", worktree.toString());
    }

    /** Drops administrative entries for worktrees whose directory is gone. */
    public CommandResult pruneWorktrees(Path dir) {
        return run(dir, "worktree", "prune");
    }

    // ------------------------------------------------------------------
    // Remote
    // ------------------------------------------------------------------

    public CommandResult push(Path dir, String branch) {
        return execute(dir, networkTimeout, "push", "-u", "origin", branch);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /** Runs {@code git <args>} in {@code dir} with the local command timeout. */
    public CommandResult run(Path dir, String... args) {
        return execute(dir, commandTimeout, args);
    }

    private CommandResult execute(Path dir, Duration timeout, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(executable);
        command.addAll(List.of(args));

        Timer.Sample sample = Timer.start(meterRegistry);
        CommandResult result = runner.run(command, dir, timeout);
        sample.stop(meterRegistry.timer("braindump.git.command.duration",
                "command", args.length > 0 ? args[0] : "",
                "status",  result.success() ? "success" : "failure"));

        if (!result.success()) {
            // show-ref / symbolic-ref exit non-zero as a normal answer
            log.debug("git {} failed in {} (exit {}): {}",
                    String.join(" ", args), dir, result.exitCode(), result.error());
        }
        return result;
    }
}
