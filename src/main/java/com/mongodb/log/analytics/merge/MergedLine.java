package com.mongodb.log.analytics.merge;

import java.time.OffsetDateTime;

public final class MergedLine {

    private final int streamIndex;
    private final String text;
    private final OffsetDateTime timestamp;

    public MergedLine(int streamIndex, String text, OffsetDateTime timestamp) {
        this.streamIndex = streamIndex;
        this.text = text;
        this.timestamp = timestamp;
    }

    public int getStreamIndex() {
        return streamIndex;
    }

    /** The output line, label and adjusted timestamp applied. */
    public String getText() {
        return text;
    }

    /**
     * The timestamp the line was ordered by. For lines without one this is the timestamp
     * of the line selected before it.
     */
    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return text;
    }
}
