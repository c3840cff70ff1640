package com.audioflow.processing.service;

public interface TransportAdapter {
    TransportResponse fetch(String url, FetchOptions options);
}
