package com.audioflow.common.exception;

import org.springframework.http.HttpStatus;

public class DownloadFailedException extends ApiException {

    public DownloadFailedException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCodes.DOWNLOAD_ERROR, message, cause);
    }
}
