package com.audioflow.transcriptions.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class LanguageTagConverter implements AttributeConverter<LanguageTag, String> {

    @Override
    public String convertToDatabaseColumn(LanguageTag attribute) {
        return attribute == null ? null : attribute.tag();
    }

    @Override
    public LanguageTag convertToEntityAttribute(String dbData) {
        return dbData == null ? null : LanguageTag.fromValue(dbData);
    }
}
