package com.dpw.robotqase.exception;

import lombok.Getter;

/**
 * A Qase API call failed: transport error, non-2xx status or a response whose {@code status} flag is not true.
 */
@Getter
public class QaseApiException extends RuntimeException {

    private final String operation;
    private final Integer httpStatus;   // null when no response was received
    private final String responseBody;

    public QaseApiException(String operation, Integer httpStatus, String responseBody, String message) {
        this(operation, httpStatus, responseBody, message, null);
    }

    public QaseApiException(String operation, Integer httpStatus, String responseBody, String message, Throwable cause) {
        super(String.format("Failed to %s: %s", operation, message), cause);
        this.operation = operation;
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
    }
}
