package com.mongodb.log.analytics;

public class LabelCountMismatchException extends LogAnalyticsException {

    private static final long serialVersionUID = 1L;

    public LabelCountMismatchException(int labelCount, int streamCount) {
        super(String.format("Number of labels (%d) not the same as number of streams (%d)", labelCount, streamCount));
    }
}
