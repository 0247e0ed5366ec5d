package com.mongodb.log.analytics.record;

/**
 * Timestamp encodings written by the different server versions.
 */
public enum TimestampFormat {

    /** {@code Wed Dec 31 19:00:00}, second precision, before 2.4 */
    CTIME_LEGACY("ctime-pre2.4"),
    /** {@code Wed Dec 31 19:00:00.000} */
    CTIME("ctime"),
    /** {@code 1970-01-01T00:00:00.000Z} */
    ISO8601_UTC("iso8601-utc"),
    /** {@code 1969-12-31T19:00:00.000+05:00} */
    ISO8601_LOCAL("iso8601-local"),
    NONE("none");

    private final String label;

    TimestampFormat(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isCtime() {
        return this == CTIME || this == CTIME_LEGACY;
    }

    public boolean isIso8601() {
        return this == ISO8601_UTC || this == ISO8601_LOCAL;
    }

    public static TimestampFormat findByLabel(String label) {
        for (TimestampFormat format : values()) {
            if (format.label.equalsIgnoreCase(label) || format.name().equalsIgnoreCase(label)) {
                return format;
            }
        }
        return null;
    }
}
