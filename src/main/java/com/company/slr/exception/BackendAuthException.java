package com.company.slr.exception;

/**
 * Backend rejected our credentials (HTTP 401). Not retryable without operator action.
 */
public class BackendAuthException extends SourceException {
    public BackendAuthException(String message) {
        super(message);
    }

    public BackendAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
