package com.braindump.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An enum whose persisted (and JSON) form is a stable lowercase string such as
 * {@code in_progress}. Other tools read these columns directly, so the strings
 * must never follow Java constant renames.
 */
public interface PersistedValue {

    @JsonValue
    String value();

    static <E extends Enum<E> & PersistedValue> E fromValue(Class<E> type, String value) {
        for (E constant : type.getEnumConstants()) {
            if (constant.value().equals(value)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                "Unknown " + type.getSimpleName() + " value: '" + value + "'");
    }
}
