package com.company.slr.exception;

/**
 * Invalid indicator source configuration, or a logical error reported by a backend.
 * Messages are meant to be shown to the indicator owner as-is.
 */
public class SourceException extends RuntimeException {
    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
