package com.audioflow.streaming.dto;

public interface OutboundMessage {
    String type();
}
