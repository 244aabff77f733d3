package com.braindump.orchestrator.model;

import java.util.List;

/**
 * Free-form ticket data kept in a single versioned JSON column: tags, subtasks,
 * attachments and linked files.
 *
 * A payload that cannot be read comes back as {@link #unavailable(String)}. The raw
 * text is held on to so that saving the ticket writes it back untouched.
 */
public record TicketMetadata(
        int schemaVersion,
        List<String> tags,
        List<Subtask> subtasks,
        List<Attachment> attachments,
        List<String> linkedFiles,
        String unreadablePayload
) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public record Subtask(String id, String text, boolean completed) {}

    public record Attachment(String filename, String path, String contentType) {}

    public TicketMetadata {
        tags        = tags == null ? List.of() : List.copyOf(tags);
        subtasks    = subtasks == null ? List.of() : List.copyOf(subtasks);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        linkedFiles = linkedFiles == null ? List.of() : List.copyOf(linkedFiles);
    }

    public static TicketMetadata empty() {
        return new TicketMetadata(CURRENT_SCHEMA_VERSION, List.of(), List.of(), List.of(), List.of(), null);
    }

    public static TicketMetadata unavailable(String rawPayload) {
        return new TicketMetadata(0, List.of(), List.of(), List.of(), List.of(), rawPayload);
    }

    public boolean available() {
        return unreadablePayload == null;
    }
}
