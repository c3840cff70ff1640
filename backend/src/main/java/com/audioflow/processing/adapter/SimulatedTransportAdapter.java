package com.audioflow.processing.adapter;

import com.audioflow.common.util.AudioUrls;
import com.audioflow.processing.service.FetchOptions;
import com.audioflow.processing.service.TransportAdapter;
import com.audioflow.processing.service.TransportException;
import com.audioflow.processing.service.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

public class SimulatedTransportAdapter implements TransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTransportAdapter.class);

    private final Duration delay;

    public SimulatedTransportAdapter(Duration delay) {
        this.delay = delay;
    }

    @Override
    public TransportResponse fetch(String url, FetchOptions options) {
        log.info("Simulated GET {}", url);
        pause();

        byte[] payload = switch (options.responseShape()) {
            case BINARY -> ("MOCK_AUDIO_DATA_FOR_" + AudioUrls.filenameFromUrl(url)).getBytes(StandardCharsets.UTF_8);
            case JSON -> "{\"success\":true}".getBytes(StandardCharsets.UTF_8);
            case TEXT -> ("Simulated response for " + AudioUrls.filenameFromUrl(url)).getBytes(StandardCharsets.UTF_8);
        };
        String contentType = switch (options.responseShape()) {
            case BINARY -> "audio/mpeg";
            case JSON -> "application/json";
            case TEXT -> "text/plain";
        };

        return new TransportResponse(200, Map.of(
                "content-type", contentType,
                "content-length", String.valueOf(payload.length)
        ), payload);
    }

    private void pause() {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new TransportException("Simulated fetch interrupted", exception);
        }
    }
}
