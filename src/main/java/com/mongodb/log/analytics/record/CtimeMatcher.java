package com.mongodb.log.analytics.record;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches the four-token ctime timestamps ({@code Sun Aug  3 21:52:05[.095]}).
 * These carry no year and no zone: the year comes from the {@link ParserConfig} and
 * the value is taken as UTC.
 */
public class CtimeMatcher implements TimestampMatcher {

    static final List<String> WEEKDAYS = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");
    static final List<String> MONTHS = List.of("Jan", "Feb", "Mar", "Apr", "May", "Jun",
            "Jul", "Aug", "Sep", "Oct", "Nov", "Dec");

    private static final Pattern DAY_PATTERN = Pattern.compile("^\\d{1,2}$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{3}))?$");

    @Override
    public Optional<TimestampMatch> tryMatch(List<String> tokens, int offset, ParserConfig config) {
        if (tokens.size() < offset + 4) {
            return Optional.empty();
        }
        String weekday = tokens.get(offset);
        String month = tokens.get(offset + 1);
        String day = tokens.get(offset + 2);
        if (!WEEKDAYS.contains(weekday) || !MONTHS.contains(month) || !DAY_PATTERN.matcher(day).matches()) {
            return Optional.empty();
        }
        Matcher time = TIME_PATTERN.matcher(tokens.get(offset + 3));
        if (!time.matches()) {
            return Optional.empty();
        }

        String millis = time.group(4);
        OffsetDateTime dt;
        try {
            LocalDateTime local = LocalDateTime.of(config.getYearHint(), MONTHS.indexOf(month) + 1,
                    Integer.parseInt(day), Integer.parseInt(time.group(1)), Integer.parseInt(time.group(2)),
                    Integer.parseInt(time.group(3)), millis == null ? 0 : Integer.parseInt(millis) * 1_000_000);
            dt = OffsetDateTime.of(local, ZoneOffset.UTC);
        } catch (DateTimeException e) {
            // e.g. Feb 29 against a non-leap year hint
            return Optional.empty();
        }

        OffsetDateTime rollover = config.getRolloverThreshold();
        if (rollover != null && dt.isAfter(rollover)) {
            dt = dt.minusYears(1);
        }
        TimestampFormat format = millis != null ? TimestampFormat.CTIME : TimestampFormat.CTIME_LEGACY;
        return Optional.of(new TimestampMatch(dt, format, offset, 4));
    }
}
