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
 * Matches single-token timestamps such as {@code 2013-08-03T11:52:05.095Z} or
 * {@code 2013-08-03T21:52:05.095+1000}.
 */
public class Iso8601Matcher implements TimestampMatcher {

    private static final Pattern ISO_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{3})\\d*(Z|[+-]\\d{2}:?\\d{2})?$");

    @Override
    public Optional<TimestampMatch> tryMatch(List<String> tokens, int offset, ParserConfig config) {
        if (offset >= tokens.size()) {
            return Optional.empty();
        }
        Matcher m = ISO_PATTERN.matcher(tokens.get(offset));
        if (!m.matches()) {
            return Optional.empty();
        }
        String zone = m.group(2);
        try {
            LocalDateTime local = LocalDateTime.parse(m.group(1));
            ZoneOffset zoneOffset = zone == null ? ZoneOffset.UTC : ZoneOffset.of(zone);
            TimestampFormat format = "Z".equals(zone) ? TimestampFormat.ISO8601_UTC : TimestampFormat.ISO8601_LOCAL;
            return Optional.of(new TimestampMatch(OffsetDateTime.of(local, zoneOffset), format, offset, 1));
        } catch (DateTimeException e) {
            // shaped like a timestamp but not a real instant (month 13, offset +25:00)
            return Optional.empty();
        }
    }
}
