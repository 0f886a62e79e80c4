package com.company.slr.exception;

/**
 * HTTP failure, timeout or malformed response from a metric backend.
 * The next scheduled update cycle retries naturally.
 */
public class BackendTransportException extends RuntimeException {
    public BackendTransportException(String message) {
        super(message);
    }

    public BackendTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
