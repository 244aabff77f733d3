package com.braindump.orchestrator.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Opens pull requests through the GitHub CLI ({@code gh}).
 */
@Component
public class PullRequestClient {

    private static final Logger log = LoggerFactory.getLogger(PullRequestClient.class);

    /** Outcome of {@link #createDraft}. {@code number} is null when it could not be read from the URL. */
    public record PullRequest(boolean created, Integer number, String url, String error) {

        static PullRequest failed(String error) {
            return new PullRequest(false, null, null, error);
        }
    }

    private final CommandRunner runner;
    private final String        executable;
    private final Duration      timeout;

    public PullRequestClient(
            CommandRunner runner,
            @Value("${braindump.git.gh-executable:gh}") String executable,
            @Value("${braindump.git.network-timeout-sec:120}") long timeoutSec) {
        this.runner     = runner;
        this.executable = executable;
        this.timeout    = Duration.ofSeconds(timeoutSec);
    }

    public PullRequest createDraft(Path dir, String title, String body) {
        CommandResult result = runner.run(
                List.of(executable, "pr", "create", "--draft", "--title", title, "--body", body),
                dir, timeout);
        if (!result.success()) {
            log.warn("gh pr create failed in {}: {}", dir, result.error());
            return PullRequest.failed(result.error());
        }
        String url = lastLine(result.output());
        Integer number = parseNumber(url);
        log.info("Draft PR created: {}", url);
        return new PullRequest(true, number, url, null);
    }

    // gh prints the PR URL; the number is its last path segment.
    static Integer parseNumber(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String last = url.substring(url.lastIndexOf('/') + 1).trim();
        try {
            return Integer.valueOf(last);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String lastLine(String output) {
        List<String> lines = output.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
        return lines.isEmpty() ? "" : lines.get(lines.size() - 1);
    }
}
