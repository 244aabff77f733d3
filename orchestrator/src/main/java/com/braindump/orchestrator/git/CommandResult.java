package com.braindump.orchestrator.git;

import java.util.List;

/**
 * Outcome of one external command. {@code output} and {@code error} are the
 * trimmed stdout and stderr.
 */
public record CommandResult(String command, boolean success, int exitCode, String output, String error) {

    public static CommandResult ok(String command, String output) {
        return new CommandResult(command, true, 0, output, "");
    }

    public static CommandResult failed(String command, int exitCode, String error) {
        return new CommandResult(command, false, exitCode, "", error);
    }

    /** Non-empty output lines. */
    public List<String> lines() {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        return output.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
    }
}
