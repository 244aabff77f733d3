package com.braindump.orchestrator.model.convert;

import com.braindump.orchestrator.model.DemoStep;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Stores demo steps as {@code {"schemaVersion":1,"steps":[...]}}. A bare JSON array
 * (the unversioned form) is still accepted on read.
 */
@Converter
public class DemoStepsConverter implements AttributeConverter<List<DemoStep>, String> {

    private static final Logger log = LoggerFactory.getLogger(DemoStepsConverter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int CURRENT_SCHEMA_VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Payload(Integer schemaVersion, List<DemoStep> steps) {}

    @Override
    public String convertToDatabaseColumn(List<DemoStep> steps) {
        try {
            return MAPPER.writeValueAsString(new Payload(CURRENT_SCHEMA_VERSION,
                    steps == null ? List.of() : steps));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise demo steps", e);
        }
    }

    @Override
    public List<DemoStep> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return List.of();
        }
        try {
            if (dbData.stripLeading().startsWith("[")) {
                return withoutNulls(Arrays.asList(MAPPER.readValue(dbData, DemoStep[].class)));
            }
            Payload payload = MAPPER.readValue(dbData, Payload.class);
            if (payload == null) {
                log.warn("Demo steps are a JSON null; returning none");
                return List.of();
            }
            return withoutNulls(payload.steps());
        } catch (JsonProcessingException e) {
            log.warn("Demo steps are unreadable; returning none: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static List<DemoStep> withoutNulls(List<DemoStep> steps) {
        return steps == null ? List.of() : steps.stream().filter(Objects::nonNull).toList();
    }
}
