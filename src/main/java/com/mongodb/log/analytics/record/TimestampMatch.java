package com.mongodb.log.analytics.record;

import java.time.OffsetDateTime;

/**
 * Result of a successful timestamp match: the value, its encoding, and where in the
 * token list it was found.
 */
public final class TimestampMatch {

    private final OffsetDateTime timestamp;
    private final TimestampFormat format;
    private final int offset;
    private final int width;

    public TimestampMatch(OffsetDateTime timestamp, TimestampFormat format, int offset, int width) {
        this.timestamp = timestamp;
        this.format = format;
        this.offset = offset;
        this.width = width;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public TimestampFormat getFormat() {
        return format;
    }

    /** Index of the first timestamp token. */
    public int getOffset() {
        return offset;
    }

    /** Number of tokens the timestamp spans. */
    public int getWidth() {
        return width;
    }

    /** Index of the first token after the timestamp. */
    public int getNextPosition() {
        return offset + width;
    }
}
