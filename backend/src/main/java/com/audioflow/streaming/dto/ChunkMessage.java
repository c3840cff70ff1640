package com.audioflow.streaming.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkMessage(
        @JsonProperty("type") String type,
        @JsonProperty("data") String data,
        @JsonProperty("isLast") Boolean isLast
) {

    public static final String TYPE = "chunk";

    public boolean isChunk() {
        return TYPE.equals(type);
    }

    public boolean last() {
        return Boolean.TRUE.equals(isLast);
    }
}
