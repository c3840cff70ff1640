package com.audioflow.streaming.service;

public enum SessionState {
    OPEN,
    RECEIVING,
    FINALIZING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
