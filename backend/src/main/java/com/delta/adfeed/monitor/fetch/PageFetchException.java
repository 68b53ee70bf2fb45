package com.delta.adfeed.monitor.fetch;

import java.io.IOException;

public class PageFetchException extends IOException {
    private final String errorCode;

    public PageFetchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PageFetchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
