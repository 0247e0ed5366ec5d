package com.mongodb.log.analytics.record;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders timestamps in the textual encodings found in server logs.
 */
public final class TimestampFormatter {

    private static final DateTimeFormatter CTIME_LEGACY = DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss", Locale.ENGLISH);
    private static final DateTimeFormatter CTIME = DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss.SSS", Locale.ENGLISH);
    private static final DateTimeFormatter ISO8601_UTC = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ENGLISH);
    private static final DateTimeFormatter ISO8601_LOCAL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSxxx", Locale.ENGLISH);

    private TimestampFormatter() {
    }

    public static String format(OffsetDateTime timestamp, TimestampFormat format) {
        switch (format) {
        case CTIME_LEGACY:
            return CTIME_LEGACY.format(timestamp);
        case CTIME:
            return CTIME.format(timestamp);
        case ISO8601_UTC:
            return ISO8601_UTC.format(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
        case ISO8601_LOCAL:
            return ISO8601_LOCAL.format(timestamp);
        default:
            throw new IllegalArgumentException("Invalid datetime format " + format
                    + ", choose from ctime, ctime-pre2.4, iso8601-utc, iso8601-local");
        }
    }
}
