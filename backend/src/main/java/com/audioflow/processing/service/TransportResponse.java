package com.audioflow.processing.service;

import java.util.Map;

public record TransportResponse(
        int statusCode,
        Map<String, String> headers,
        byte[] payload
) {

    public String contentType() {
        return headers.getOrDefault("content-type", "application/octet-stream");
    }
}
