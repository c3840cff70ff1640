package com.audioflow.transcriptions.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum LanguageTag {
    EN_US("en-US"),
    FR_FR("fr-FR"),
    ES_ES("es-ES"),
    DE_DE("de-DE"),
    IT_IT("it-IT"),
    JA_JP("ja-JP"),
    KO_KR("ko-KR");

    public static final LanguageTag DEFAULT = EN_US;

    private final String tag;

    LanguageTag(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static Optional<LanguageTag> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (LanguageTag language : values()) {
            if (language.tag.equalsIgnoreCase(value.trim())) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static LanguageTag fromValue(String value) {
        if (value == null) {
            return null;
        }
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + value));
    }
}
