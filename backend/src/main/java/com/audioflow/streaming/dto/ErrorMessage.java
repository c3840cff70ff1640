package com.audioflow.streaming.dto;

public record ErrorMessage(
        String type,
        String message,
        String code
) implements OutboundMessage {

    public static ErrorMessage of(String message, String code) {
        return new ErrorMessage("error", message, code);
    }
}
