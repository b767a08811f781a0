package com.yoursp.emailconnections.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ConnectionStatus} as its lowercase value.
 */
@Converter(autoApply = true)
public class ConnectionStatusConverter implements AttributeConverter<ConnectionStatus, String> {

    @Override
    public String convertToDatabaseColumn(ConnectionStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public ConnectionStatus convertToEntityAttribute(String dbData) {
        return ConnectionStatus.fromValue(dbData);
    }
}
