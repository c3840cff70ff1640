package com.audioflow.processing.service;

import java.time.Duration;

public record FetchOptions(
        Duration timeout,
        long maxPayloadBytes,
        ResponseShape responseShape,
        boolean validateStatus
) {

    public static FetchOptions audio(Duration timeout, long maxPayloadBytes) {
        return new FetchOptions(timeout, maxPayloadBytes, ResponseShape.BINARY, true);
    }
}
