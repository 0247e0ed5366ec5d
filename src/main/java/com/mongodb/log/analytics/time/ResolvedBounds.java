package com.mongodb.log.analytics.time;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * A {@code from}/{@code to} pair resolved against a {@link TimeRange}. Always lies
 * inside that range.
 */
public final class ResolvedBounds {

    private final OffsetDateTime from;
    private final OffsetDateTime to;

    public ResolvedBounds(OffsetDateTime from, OffsetDateTime to) {
        this.from = from;
        this.to = to;
    }

    public OffsetDateTime getFrom() {
        return from;
    }

    public OffsetDateTime getTo() {
        return to;
    }

    public boolean contains(OffsetDateTime value) {
        return !value.isBefore(from) && !value.isAfter(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedBounds other = (ResolvedBounds) o;
        return from.isEqual(other.from) && to.isEqual(other.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from.toInstant(), to.toInstant());
    }

    @Override
    public String toString() {
        return "from " + from + " to " + to;
    }
}
