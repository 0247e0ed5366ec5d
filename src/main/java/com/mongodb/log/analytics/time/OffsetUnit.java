package com.mongodb.log.analytics.time;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Units accepted in relative expressions like {@code +3min} or {@code -2d}. Months and
 * years are approximated in days (30.43 and 365.24), truncated to whole days.
 */
public enum OffsetUnit {
    SECONDS(Duration.ofSeconds(1), 0, "secs", "sec", "s"),
    MINUTES(Duration.ofMinutes(1), 0, "mins", "min", "m"),
    HOURS(Duration.ofHours(1), 0, "hours", "hour", "h"),
    DAYS(Duration.ofDays(1), 0, "days", "day", "d"),
    WEEKS(Duration.ZERO, 7, "weeks", "week", "w"),
    MONTHS(Duration.ZERO, 30.43, "months", "month", "mo"),
    YEARS(Duration.ZERO, 365.24, "years", "year", "y");

    private final Duration exact;
    private final double days;
    private final List<String> names;

    OffsetUnit(Duration exact, double days, String... names) {
        this.exact = exact;
        this.days = days;
        this.names = List.of(names);
    }

    public List<String> getNames() {
        return names;
    }

    public static OffsetUnit findByName(String name) {
        for (OffsetUnit unit : values()) {
            if (unit.names.contains(name)) {
                return unit;
            }
        }
        return null;
    }

    /**
     * Regex alternation over all unit names, longest names first within each unit.
     */
    static String alternation() {
        StringBuilder sb = new StringBuilder();
        for (OffsetUnit unit : values()) {
            for (String name : unit.names) {
                if (sb.length() > 0) {
                    sb.append('|');
                }
                sb.append(name);
            }
        }
        return sb.toString();
    }

    public OffsetDateTime apply(OffsetDateTime value, long amount) {
        if (days == 0) {
            return value.plus(exact.multipliedBy(amount));
        }
        return value.plusDays((long) (days * amount));
    }
}
