package com.braindump.orchestrator.git;

import com.braindump.orchestrator.model.Epic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Decides where an epic's worktree lives.
 *
 * <ul>
 *   <li>{@code sibling}   : {@code <parent>/<project>-epic-<id>-<slug>}</li>
 *   <li>{@code subfolder} : {@code <project>/.worktrees/epic-<id>-<slug>}</li>
 * </ul>
 */
@Component
public class WorktreeLayout {

    public enum Location { SIBLING, SUBFOLDER }

    private final Location location;

    public WorktreeLayout(@Value("${braindump.worktree.location:sibling}") String location) {
        this.location = Location.valueOf(location.trim().toUpperCase(Locale.ROOT));
    }

    public Path worktreePathFor(Path projectPath, Epic epic) {
        String dir = BranchNames.epicDirectory(epic.getId(), epic.getTitle());
        Path project = projectPath.toAbsolutePath().normalize();
        if (location == Location.SUBFOLDER) {
            return project.resolve(".worktrees").resolve(dir);
        }
        Path parent = project.getParent() != null ? project.getParent() : project;
        return parent.resolve(project.getFileName() + "-" + dir);
    }

    public Location getLocation() { return location; }
}
