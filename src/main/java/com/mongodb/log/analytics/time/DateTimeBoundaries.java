package com.mongodb.log.analytics.time;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.InvalidRangeException;
import com.mongodb.log.analytics.UnrecognizedExpressionException;

/**
 * Resolves human-readable time expressions ({@code "Sat 10:00"}, {@code "start +3h"},
 * {@code "29 Sep 13:06"}, {@code "-2d"}) into absolute timestamps relative to the
 * observed range of a log stream.
 * <p>
 * An expression is read in categories: a constant ({@code now start end today yesterday}),
 * a weekday, a clock time and a signed offset are each cut out at their first occurrence,
 * and whatever remains goes to a lenient date parser. Expressions without a 4-digit year
 * are shifted by a year when that brings them inside the range.
 */
public class DateTimeBoundaries {

    private static final Logger logger = LoggerFactory.getLogger(DateTimeBoundaries.class);

    private static final List<String> WEEKDAYS = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");

    private static final Pattern CONSTANT = Pattern.compile("(?:^|(?<=\\s))(now|start|end|today|yesterday)(?:$|\\s+)");
    private static final Pattern WEEKDAY = Pattern.compile("(?:^|(?<=\\s))(" + String.join("|", WEEKDAYS) + ")(?:$|\\s+)");
    private static final Pattern TIME = Pattern.compile(
            "(?:^|(?<=\\s))(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{3}))?)?(?:$|\\s+)");
    private static final Pattern OFFSET = Pattern.compile(
            "(?:^|(?<=\\s))([+-])(\\d+)(" + OffsetUnit.alternation() + ")(?:$|\\s+)");
    private static final Pattern FOUR_DIGIT_YEAR = Pattern.compile("\\d{4}");

    private final TimeRange range;
    private final Clock clock;
    private final FallbackDateParser fallbackParser = new FallbackDateParser();

    public DateTimeBoundaries(TimeRange range) {
        this(range, Clock.systemUTC());
    }

    public DateTimeBoundaries(TimeRange range, Clock clock) {
        this.range = range;
        this.clock = clock;
    }

    public TimeRange getRange() {
        return range;
    }

    /**
     * Resolves both expressions and clamps them into the range. Empty expressions mean
     * the start and the end of the range respectively.
     *
     * @throws UnrecognizedExpressionException when part of an expression cannot be read
     * @throws InvalidRangeException when {@code to} resolves before {@code from}
     */
    public ResolvedBounds resolve(String fromExpr, String toExpr) {
        OffsetDateTime from = toDateTime(fromExpr, null);
        OffsetDateTime to = toDateTime(toExpr, from);
        if (to.isBefore(from)) {
            throw new InvalidRangeException("Lower bound " + from + " is greater than upper bound " + to);
        }
        from = clamp(from);
        to = clamp(to);
        logger.debug("Resolved '{}' .. '{}' to {} .. {}", fromExpr, toExpr, from, to);
        return new ResolvedBounds(from, to);
    }

    /**
     * Resolves a single expression.
     *
     * @param lowerBound the already resolved {@code from} value when resolving a {@code to}
     *        expression, otherwise null
     */
    public OffsetDateTime toDateTime(String expression, OffsetDateTime lowerBound) {
        String s = expression == null ? "" : expression.trim();
        if (s.isEmpty()) {
            return lowerBound != null ? range.getEnd() : range.getStart();
        }
        String original = s;

        Matcher constant = CONSTANT.matcher(s);
        String constantValue = null;
        if (constant.find()) {
            constantValue = constant.group(1);
            s = cut(s, constant);
        }
        Matcher weekday = WEEKDAY.matcher(s);
        String weekdayValue = null;
        if (weekday.find()) {
            weekdayValue = weekday.group(1);
            s = cut(s, weekday);
        }
        Matcher time = TIME.matcher(s);
        int[] timeValue = null;
        if (time.find()) {
            timeValue = new int[] { Integer.parseInt(time.group(1)), Integer.parseInt(time.group(2)),
                    time.group(3) == null ? 0 : Integer.parseInt(time.group(3)),
                    time.group(4) == null ? 0 : Integer.parseInt(time.group(4)) };
            s = cut(s, time);
        }
        Matcher offset = OFFSET.matcher(s);
        String offsetSign = null;
        long offsetAmount = 0;
        OffsetUnit offsetUnit = null;
        if (offset.find()) {
            offsetSign = offset.group(1);
            try {
                offsetAmount = Long.parseLong(offset.group(2));
            } catch (NumberFormatException e) {
                throw new UnrecognizedExpressionException(original, e);
            }
            offsetUnit = OffsetUnit.findByName(offset.group(3));
            s = cut(s, offset);
        }
        String remainder = s.trim();

        OffsetDateTime dt = null;
        if (constantValue != null) {
            dt = constantDateTime(constantValue);
        } else if (weekdayValue != null) {
            dt = mostRecent(weekdayValue);
        }

        if (!remainder.isEmpty()) {
            OffsetDateTime defaultValue = dt != null ? dt
                    : OffsetDateTime.of(range.getEnd().getYear(), 1, 1, 0, 0, 0, 0, range.getStart().getOffset());
            dt = fallbackParser.parse(remainder, defaultValue);
        } else if (dt == null && timeValue != null) {
            // time only: the date of the range edge being resolved
            OffsetDateTime edge = lowerBound != null ? range.getEnd() : range.getStart();
            dt = edge.truncatedTo(ChronoUnit.DAYS);
        }

        if (dt == null) {
            dt = lowerBound != null ? lowerBound : range.getEnd();
        }

        if (timeValue != null) {
            dt = withTime(dt, timeValue, original);
        }

        if (offsetUnit != null) {
            try {
                dt = offsetUnit.apply(dt, "-".equals(offsetSign) ? -offsetAmount : offsetAmount);
            } catch (DateTimeException | ArithmeticException e) {
                // offset moves the value outside the supported date range
                throw new UnrecognizedExpressionException(original, e);
            }
        }

        if (constantValue == null && !FOUR_DIGIT_YEAR.matcher(original).find()) {
            dt = correctYear(dt);
        }
        return dt;
    }

    private OffsetDateTime constantDateTime(String constant) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(range.getStart().getOffset());
        switch (constant) {
        case "start":
            return range.getStart();
        case "end":
            return range.getEnd();
        case "today":
            return now.truncatedTo(ChronoUnit.DAYS);
        case "yesterday":
            return now.truncatedTo(ChronoUnit.DAYS).minusDays(1);
        default:
            return now;
        }
    }

    /**
     * Midnight of the most recent given weekday at or before the end of the range.
     */
    private OffsetDateTime mostRecent(String weekday) {
        OffsetDateTime endDay = range.getEnd().truncatedTo(ChronoUnit.DAYS);
        DayOfWeek target = DayOfWeek.of(WEEKDAYS.indexOf(weekday) + 1);
        int back = Math.floorMod(endDay.getDayOfWeek().getValue() - target.getValue(), 7);
        return endDay.minusDays(back);
    }

    private OffsetDateTime withTime(OffsetDateTime dt, int[] time, String expression) {
        try {
            return dt.withHour(time[0]).withMinute(time[1]).withSecond(time[2]).withNano(time[3] * 1_000_000);
        } catch (DateTimeException e) {
            throw new UnrecognizedExpressionException(expression, e);
        }
    }

    private OffsetDateTime correctYear(OffsetDateTime dt) {
        if (dt.isBefore(range.getStart())) {
            OffsetDateTime next = dt.plusYears(1);
            if (range.contains(next)) {
                return next;
            }
        } else if (dt.isAfter(range.getEnd())) {
            OffsetDateTime previous = dt.minusYears(1);
            if (range.contains(previous)) {
                return previous;
            }
        }
        return dt;
    }

    private OffsetDateTime clamp(OffsetDateTime value) {
        if (value.isBefore(range.getStart())) {
            return range.getStart();
        }
        if (value.isAfter(range.getEnd())) {
            return range.getEnd();
        }
        return value;
    }

    private static String cut(String s, Matcher m) {
        return s.substring(0, m.start()) + " " + s.substring(m.end());
    }
}
