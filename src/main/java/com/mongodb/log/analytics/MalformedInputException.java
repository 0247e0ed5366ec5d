package com.mongodb.log.analytics;

/**
 * Raised when a raw record is empty or cannot be read as text at all.
 */
public class MalformedInputException extends LogAnalyticsException {

    private static final long serialVersionUID = 1L;

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
