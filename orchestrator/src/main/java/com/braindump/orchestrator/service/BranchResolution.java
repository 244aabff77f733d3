package com.braindump.orchestrator.service;

import java.nio.file.Path;

/**
 * Which branch a ticket (or epic) was put on, and what had to be created for it.
 *
 * @param created          the branch did not exist before this call
 * @param worktreeCreated  a worktree directory was added by this call
 * @param previousRef      what HEAD of the project pointed at before, used to undo a checkout
 */
public record BranchResolution(
        String branchName,
        boolean created,
        boolean usingEpicBranch,
        Path workingDirectory,
        boolean worktreeCreated,
        String previousRef
) {}
