package com.mongodb.log.analytics.filter;

import java.time.OffsetDateTime;

import com.mongodb.log.analytics.record.ParsedRecord;
import com.mongodb.log.analytics.time.ResolvedBounds;

/**
 * Keeps records inside resolved time bounds. Lines without a timestamp are kept only
 * while the stream is inside the bounds, so continuation lines follow their record.
 */
public class DateTimeFilter {

    private final ResolvedBounds bounds;
    private boolean started;
    private boolean exhausted;

    public DateTimeFilter(ResolvedBounds bounds) {
        this.bounds = bounds;
    }

    public boolean accept(ParsedRecord record) {
        OffsetDateTime ts = record.getTimestamp();
        if (ts == null) {
            return started && !exhausted;
        }
        if (ts.isBefore(bounds.getFrom())) {
            return false;
        }
        if (ts.isAfter(bounds.getTo())) {
            exhausted = true;
            return false;
        }
        started = true;
        return true;
    }

    /**
     * @return true once a record after the upper bound was seen, nothing further can match
     */
    public boolean isExhausted() {
        return exhausted;
    }

    public ResolvedBounds getBounds() {
        return bounds;
    }
}
