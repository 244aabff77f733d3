package com.braindump.orchestrator.model.convert;

import com.braindump.orchestrator.model.PersistedValue;
import jakarta.persistence.AttributeConverter;

/**
 * Maps a {@link PersistedValue} enum to its stable string column value.
 * Subclasses only bind the enum type; see {@link EnumConverters}.
 */
public abstract class PersistedValueConverter<E extends Enum<E> & PersistedValue>
        implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected PersistedValueConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PersistedValue.fromValue(type, dbData);
    }
}
