package com.audioflow.processing.service;

public enum ResponseShape {
    BINARY,
    JSON,
    TEXT
}
