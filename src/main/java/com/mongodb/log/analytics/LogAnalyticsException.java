package com.mongodb.log.analytics;

/**
 * Base type for the fatal conditions raised by the log analytics engine.
 * Missing fields on a record are never reported this way.
 */
public class LogAnalyticsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LogAnalyticsException(String message) {
        super(message);
    }

    public LogAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
