package com.audioflow.common.exception;

public final class ErrorCodes {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_URL = "INVALID_URL";
    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    public static final String UNSUPPORTED_LANGUAGE = "UNSUPPORTED_LANGUAGE";
    public static final String DOWNLOAD_ERROR = "DOWNLOAD_ERROR";
    public static final String RECOGNITION_ERROR = "RECOGNITION_ERROR";
    public static final String PERSISTENCE_ERROR = "PERSISTENCE_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
    }
}
