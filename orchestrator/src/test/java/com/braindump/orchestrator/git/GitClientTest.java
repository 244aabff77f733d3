package com.braindump.orchestrator.git;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GitClientTest {

    @TempDir Path repo;

    SimpleMeterRegistry meters = new SimpleMeterRegistry();

    private GitClient client(FakeGitRunner runner) {
        return new GitClient(runner, "git", 30, 120, meters);
    }

    @Test
    void findTrunkBranch_prefersMainOverMaster() {
        assertThat(client(new FakeGitRunner(repo, "master", "main")).findTrunkBranch(repo)).isEqualTo("main");
        assertThat(client(new FakeGitRunner(repo, "master")).findTrunkBranch(repo)).isEqualTo("master");
        assertThat(client(new FakeGitRunner(repo, "develop")).findTrunkBranch(repo)).isEqualTo("main");
    }

    @Test
    void branchNames_arePassedAsSingleArguments() {
        FakeGitRunner runner = new FakeGitRunner(repo, "main");

        client(runner).createBranch(repo, "feature/x; rm -rf ~");

        assertThat(runner.executed).contains(List.of("git", "checkout", "-b", "feature/x; rm -rf ~"));
        assertThat(runner.branches).contains("feature/x; rm -rf ~");
    }

    @Test
    void currentRef_fallsBackToCommitWhenDetached() {
        FakeGitRunner runner = new FakeGitRunner(repo);

        assertThat(client(runner).currentRef(repo)).contains("0123abcd");
    }

    @Test
    void everyCommand_isTimedWithOutcome() {
        FakeGitRunner runner = new FakeGitRunner(repo, "main");
        GitClient git = client(runner);

        git.checkout(repo, "main");
        git.checkout(repo, "missing");

        assertThat(meters.get("braindump.git.command.duration")
                .tags("command", "checkout", "status", "success").timer().count()).isEqualTo(1);
        assertThat(meters.get("braindump.git.command.duration")
                .tags("command", "checkout", "status", "failure").timer().count()).isEqualTo(1);
    }

    @Test
    void commitsSince_returnsOneLinePerCommit() {
        FakeGitRunner runner = new FakeGitRunner(repo, "main");
        runner.logOutput = "abc1234 Add form\n\ndef5678 Wire submit\n";

        CommandResult result = client(runner).commitsSince(repo, "main");

        assertThat(result.lines()).containsExactly("abc1234 Add form", "def5678 Wire submit");
        assertThat(runner.executed.get(0)).containsExactly("git", "log", "main..HEAD", "--oneline", "--no-decorate");
    }
}
