package com.braindump.orchestrator.git;

import com.braindump.orchestrator.TestEntities;
import com.braindump.orchestrator.model.Epic;
import com.braindump.orchestrator.model.IsolationMode;
import com.braindump.orchestrator.model.Project;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class WorktreeLayoutTest {

    final Path projectPath = Path.of("/work/app");
    final Project project  = TestEntities.project(projectPath.toString());
    final Epic epic = TestEntities.withId(new Epic(project, "User Auth", IsolationMode.WORKTREE),
            UUID.fromString("a1b2c3d4-0000-4000-8000-000000000001"));

    @Test
    void sibling_placesWorktreeNextToProject() {
        Path path = new WorktreeLayout("sibling").worktreePathFor(projectPath, epic);

        assertThat(path).isEqualTo(Path.of("/work/app-epic-a1b2c3d4-user-auth"));
    }

    @Test
    void subfolder_placesWorktreeInsideProject() {
        Path path = new WorktreeLayout("subfolder").worktreePathFor(projectPath, epic);

        assertThat(path).isEqualTo(Path.of("/work/app/.worktrees/epic-a1b2c3d4-user-auth"));
    }
}
