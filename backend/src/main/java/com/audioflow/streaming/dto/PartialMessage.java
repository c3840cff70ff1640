package com.audioflow.streaming.dto;

public record PartialMessage(
        String type,
        String text,
        double confidence
) implements OutboundMessage {

    public static PartialMessage of(String text, double confidence) {
        return new PartialMessage("partial", text, confidence);
    }
}
