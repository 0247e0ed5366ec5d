package com.mongodb.log.analytics.time;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mongodb.log.analytics.UnrecognizedExpressionException;

/**
 * Parses the free-form date text left over after the keyword categories were cut out of
 * an expression: ISO dates and date-times, or any combination of month name, day number,
 * 4-digit year and clock time. Fields that are not given come from a default value.
 */
class FallbackDateParser {

    private static final DateTimeFormatter ISO = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .appendPattern("HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("january", 1),
            Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("apr", 4), Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("aug", 8), Map.entry("august", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
            Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("dec", 12), Map.entry("december", 12));

    private static final Pattern WEEKDAY_NAME = Pattern.compile(
            "(?i)(mon|tue|tues|wed|thu|thur|thurs|fri|sat|sun)(day|sday|nesday|rsday|urday)?");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Pattern DAY = Pattern.compile("(\\d{1,2})(st|nd|rd|th)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME = Pattern.compile("(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,6}))?)?");
    private static final Pattern ZONE = Pattern.compile("([+-]\\d{2}):?(\\d{2})");

    OffsetDateTime parse(String text, OffsetDateTime defaultValue) {
        String trimmed = text.trim();
        OffsetDateTime iso = parseIso(trimmed, defaultValue.getOffset());
        if (iso != null) {
            return iso;
        }

        Integer year = null;
        Integer month = null;
        Integer day = null;
        LocalTime time = null;
        ZoneOffset zone = null;

        for (String token : trimmed.split("[\\s,]+")) {
            if (token.isEmpty()) {
                continue;
            }
            String lower = token.toLowerCase(Locale.ENGLISH).replaceAll("\\.$", "");
            Matcher m;
            if (month == null && MONTHS.containsKey(lower)) {
                month = MONTHS.get(lower);
            } else if (WEEKDAY_NAME.matcher(token).matches()) {
                continue;
            } else if (year == null && YEAR.matcher(token).matches()) {
                year = Integer.parseInt(token);
            } else if (day == null && (m = DAY.matcher(token)).matches()) {
                day = Integer.parseInt(m.group(1));
            } else if (time == null && (m = TIME.matcher(token)).matches()) {
                time = toTime(m, text);
            } else if (zone == null && (lower.equals("z") || lower.equals("utc") || lower.equals("gmt"))) {
                zone = ZoneOffset.UTC;
            } else if (zone == null && (m = ZONE.matcher(token)).matches()) {
                zone = toZone(m.group(1) + ":" + m.group(2), text);
            } else {
                throw new UnrecognizedExpressionException(trimmed);
            }
        }

        try {
            LocalDate date = LocalDate.of(year != null ? year : defaultValue.getYear(),
                    month != null ? month : defaultValue.getMonthValue(),
                    day != null ? day : defaultValue.getDayOfMonth());
            LocalDateTime local = date.atTime(time != null ? time : defaultValue.toLocalTime());
            return OffsetDateTime.of(local, zone != null ? zone : defaultValue.getOffset());
        } catch (DateTimeException e) {
            throw new UnrecognizedExpressionException(trimmed, e);
        }
    }

    private OffsetDateTime parseIso(String text, ZoneOffset defaultOffset) {
        try {
            TemporalAccessor parsed = ISO.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).atOffset(defaultOffset);
            }
            return ((LocalDate) parsed).atStartOfDay().atOffset(defaultOffset);
        } catch (DateTimeParseException e) {
            // not ISO, try the token grammar
            return null;
        }
    }

    private static LocalTime toTime(Matcher m, String text) {
        try {
            int nanos = 0;
            if (m.group(4) != null) {
                String fraction = (m.group(4) + "000000").substring(0, 6);
                nanos = Integer.parseInt(fraction) * 1000;
            }
            return LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    m.group(3) == null ? 0 : Integer.parseInt(m.group(3)), nanos);
        } catch (DateTimeException e) {
            throw new UnrecognizedExpressionException(text.trim(), e);
        }
    }

    private static ZoneOffset toZone(String id, String text) {
        try {
            return ZoneOffset.of(id);
        } catch (DateTimeException e) {
            throw new UnrecognizedExpressionException(text.trim(), e);
        }
    }
}
