package com.mongodb.log.analytics.time;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * The observed first and last timestamp of a log stream.
 */
public final class TimeRange {

    private final OffsetDateTime start;
    private final OffsetDateTime end;

    public TimeRange(OffsetDateTime start, OffsetDateTime end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("End " + end + " cannot be before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public OffsetDateTime getStart() {
        return start;
    }

    public OffsetDateTime getEnd() {
        return end;
    }

    public boolean contains(OffsetDateTime value) {
        return !value.isBefore(start) && !value.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeRange other = (TimeRange) o;
        return start.isEqual(other.start) && end.isEqual(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start.toInstant(), end.toInstant());
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
