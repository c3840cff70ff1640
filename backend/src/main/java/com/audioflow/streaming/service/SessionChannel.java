package com.audioflow.streaming.service;

import com.audioflow.streaming.dto.OutboundMessage;

import java.io.IOException;

/**
 * Outbound side of one streaming connection.
 */
public interface SessionChannel {
    void send(OutboundMessage message) throws IOException;

    void close(boolean failed);
}
