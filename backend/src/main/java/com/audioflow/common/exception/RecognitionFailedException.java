package com.audioflow.common.exception;

import org.springframework.http.HttpStatus;

public class RecognitionFailedException extends ApiException {

    public RecognitionFailedException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, ErrorCodes.RECOGNITION_ERROR, message, cause);
    }
}
