package com.braindump.orchestrator.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * stdout and stderr go to temp files rather than pipes so a chatty command can
 * never block on a full pipe while we wait on the deadline.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Path workingDirectory, Duration timeout) {
        String display = String.join(" ", command);
        Path out = null;
        Path err = null;
        try {
            out = Files.createTempFile("braindump-cmd", ".out");
            err = Files.createTempFile("braindump-cmd", ".err");

            Process process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), display);
                return CommandResult.failed(display, -1,
                        "Timed out after " + timeout.toSeconds() + "s");
            }

            int exit      = process.exitValue();
            String stdout = Files.readString(out, StandardCharsets.UTF_8).strip();
            String stderr = Files.readString(err, StandardCharsets.UTF_8).strip();
            log.debug("'{}' exited {} in {}", display, exit, workingDirectory);
            return new CommandResult(display, exit == 0, exit, stdout, stderr);

        } catch (IOException e) {
            log.warn("Could not run '{}': {}", display, e.getMessage());
            return CommandResult.failed(display, -1, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandResult.failed(display, -1, "Interrupted");
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
