package com.audioflow.config;

public enum AdapterKind {
    SIMULATED,
    REAL
}
