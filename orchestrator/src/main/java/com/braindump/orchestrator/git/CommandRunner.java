package com.braindump.orchestrator.git;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program with an explicit argument list.
 *
 * Implementations must not route the arguments through a shell. A command that
 * cannot be started, exits non-zero or exceeds {@code timeout} is reported as an
 * unsuccessful {@link CommandResult}; nothing is thrown for it.
 */
public interface CommandRunner {

    CommandResult run(List<String> command, Path workingDirectory, Duration timeout);
}
