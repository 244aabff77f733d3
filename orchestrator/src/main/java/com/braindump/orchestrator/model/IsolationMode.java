package com.braindump.orchestrator.model;

/** How an epic's tickets share a branch: in the main working tree, or in a dedicated git worktree. */
public enum IsolationMode implements PersistedValue {

    SHARED_BRANCH("shared_branch"),
    WORKTREE("worktree");

    private final String value;

    IsolationMode(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static IsolationMode fromValue(String value) {
        return PersistedValue.fromValue(IsolationMode.class, value);
    }
}
