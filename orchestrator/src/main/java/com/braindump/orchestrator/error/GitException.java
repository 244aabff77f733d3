package com.braindump.orchestrator.error;

import com.braindump.orchestrator.git.CommandResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A git (or gh) command exited non-zero. The tool's stderr is carried verbatim.
 */
public class GitException extends WorkflowException {

    private final String command;
    private final String toolError;

    public GitException(String message, String command, String toolError) {
        this(message, command, toolError, Map.of());
    }

    /** @param extraDetails added to the details next to the command and its stderr */
    public GitException(String message, String command, String toolError, Map<String, Object> extraDetails) {
        super(Kind.EXTERNAL_TOOL_FAILURE, "GIT_ERROR",
                "Git operation failed: " + message
                        + (toolError == null || toolError.isBlank() ? "" : ": " + toolError),
                details(command, toolError, extraDetails));
        this.command   = command;
        this.toolError = toolError;
    }

    public static GitException from(String message, CommandResult result) {
        return new GitException(message, result.command(), result.error());
    }

    private static Map<String, Object> details(String command, String toolError, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", command);
        details.put("error", toolError == null ? "" : toolError);
        details.putAll(extra);
        return details;
    }

    public String getCommand()   { return command; }
    public String getToolError() { return toolError; }
}
