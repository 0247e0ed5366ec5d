package com.mongodb.log.analytics;

public class InvalidRangeException extends LogAnalyticsException {

    private static final long serialVersionUID = 1L;

    public InvalidRangeException(String message) {
        super(message);
    }
}
