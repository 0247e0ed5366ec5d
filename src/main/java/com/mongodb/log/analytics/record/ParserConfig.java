package com.mongodb.log.analytics.record;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.Year;
import java.util.Objects;

/**
 * Per-session settings for the ctime timestamp branch. The ctime formats carry no year,
 * so the year comes from a hint, and a rollover threshold moves timestamps that would
 * land after it back by one year.
 */
public final class ParserConfig {

    private final int yearHint;
    private final OffsetDateTime rolloverThreshold;

    private ParserConfig(int yearHint, OffsetDateTime rolloverThreshold) {
        this.yearHint = yearHint;
        this.rolloverThreshold = rolloverThreshold;
    }

    public static ParserConfig defaults() {
        return forClock(Clock.systemUTC());
    }

    public static ParserConfig forClock(Clock clock) {
        return new ParserConfig(Year.now(clock).getValue(), null);
    }

    public static ParserConfig forYear(int yearHint) {
        return new ParserConfig(yearHint, null);
    }

    public ParserConfig withRolloverThreshold(OffsetDateTime threshold) {
        return new ParserConfig(yearHint, threshold);
    }

    public int getYearHint() {
        return yearHint;
    }

    /**
     * @return the threshold, or null when the stream did not cross a year boundary
     */
    public OffsetDateTime getRolloverThreshold() {
        return rolloverThreshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParserConfig other = (ParserConfig) o;
        return yearHint == other.yearHint && Objects.equals(rolloverThreshold, other.rolloverThreshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(yearHint, rolloverThreshold);
    }

    @Override
    public String toString() {
        return "ParserConfig[yearHint=" + yearHint + ", rollover=" + rolloverThreshold + "]";
    }
}
