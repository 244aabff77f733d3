package com.braindump.orchestrator.git;

import java.util.Locale;
import java.util.UUID;

/**
 * Deterministic branch and directory names.
 *
 * The formats are read by other tooling and must stay stable:
 * <pre>
 *   feature/{shortId}-{slug}        ticket branch
 *   feature/epic-{shortId}-{slug}   epic branch
 * </pre>
 */
public final class BranchNames {

    static final int MAX_SLUG_LENGTH = 50;
    static final int SHORT_ID_LENGTH = 8;

    private BranchNames() {}

    /** Lowercase, runs of non-alphanumerics become '-', outer '-' trimmed, cut to 50 chars. */
    public static String slugify(String text) {
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.length() > MAX_SLUG_LENGTH ? slug.substring(0, MAX_SLUG_LENGTH) : slug;
    }

    public static String shortId(UUID id) {
        return id.toString().substring(0, SHORT_ID_LENGTH);
    }

    public static String ticketBranch(UUID ticketId, String title) {
        return "feature/" + shortId(ticketId) + "-" + slugify(title);
    }

    public static String epicBranch(UUID epicId, String title) {
        return "feature/epic-" + shortId(epicId) + "-" + slugify(title);
    }

    /** Directory suffix used for an epic's worktree, e.g. {@code epic-a1b2c3d4-auth}. */
    public static String epicDirectory(UUID epicId, String title) {
        return "epic-" + shortId(epicId) + "-" + slugify(title);
    }
}
