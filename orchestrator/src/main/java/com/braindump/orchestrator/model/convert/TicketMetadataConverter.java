package com.braindump.orchestrator.model.convert;

import com.braindump.orchestrator.model.TicketMetadata;
import com.braindump.orchestrator.model.TicketMetadata.Attachment;
import com.braindump.orchestrator.model.TicketMetadata.Subtask;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Stores {@link TicketMetadata} as versioned JSON.
 *
 * Reads never fail: a corrupt payload, or one written by a newer schema, becomes
 * {@link TicketMetadata#unavailable(String)} and the ticket itself stays usable.
 */
@Converter
public class TicketMetadataConverter implements AttributeConverter<TicketMetadata, String> {

    private static final Logger log = LoggerFactory.getLogger(TicketMetadataConverter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Payload(Integer schemaVersion, List<String> tags, List<Subtask> subtasks,
                   List<Attachment> attachments, List<String> linkedFiles) {}

    @Override
    public String convertToDatabaseColumn(TicketMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        if (!metadata.available()) {
            return metadata.unreadablePayload();
        }
        try {
            return MAPPER.writeValueAsString(new Payload(TicketMetadata.CURRENT_SCHEMA_VERSION,
                    metadata.tags(), metadata.subtasks(), metadata.attachments(), metadata.linkedFiles()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise ticket metadata", e);
        }
    }

    @Override
    public TicketMetadata convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return TicketMetadata.empty();
        }
        try {
            Payload payload = MAPPER.readValue(dbData, Payload.class);
            if (payload == null) {
                log.warn("Ticket metadata is a JSON null; treating as unavailable");
                return TicketMetadata.unavailable(dbData);
            }
            // Rows written before versioning carry no schemaVersion.
            int version = payload.schemaVersion() == null ? 1 : payload.schemaVersion();
            if (version > TicketMetadata.CURRENT_SCHEMA_VERSION) {
                log.warn("Ticket metadata has unsupported schema version {}; treating as unavailable", version);
                return TicketMetadata.unavailable(dbData);
            }
            return new TicketMetadata(version, withoutNulls(payload.tags()), withoutNulls(payload.subtasks()),
                    withoutNulls(payload.attachments()), withoutNulls(payload.linkedFiles()), null);
        } catch (JsonProcessingException e) {
            log.warn("Ticket metadata is unreadable; treating as unavailable: {}", e.getOriginalMessage());
            return TicketMetadata.unavailable(dbData);
        }
    }

    // null entries carry nothing, and the record's lists reject them
    private static <T> List<T> withoutNulls(List<T> values) {
        return values == null ? null : values.stream().filter(Objects::nonNull).toList();
    }
}
