package com.audioflow.common.exception;

public class InvalidUrlException extends BadRequestException {

    public InvalidUrlException(String url) {
        super(ErrorCodes.INVALID_URL, "Invalid URL format: " + url);
    }
}
