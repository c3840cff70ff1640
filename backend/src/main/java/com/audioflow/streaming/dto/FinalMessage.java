package com.audioflow.streaming.dto;

public record FinalMessage(
        String type,
        String text,
        String id
) implements OutboundMessage {

    public static FinalMessage of(String text, String id) {
        return new FinalMessage("final", text, id);
    }
}
