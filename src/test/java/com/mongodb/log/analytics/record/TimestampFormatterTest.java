package com.mongodb.log.analytics.record;

import static org.junit.jupiter.api.Assertions.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

public class TimestampFormatterTest {

    private final OffsetDateTime ts = OffsetDateTime.of(2013, 8, 5, 20, 26, 32, 95_000_000, ZoneOffset.ofHours(10));

    @Test
    public void testFormats() {
        assertEquals("Mon Aug 5 20:26:32", TimestampFormatter.format(ts, TimestampFormat.CTIME_LEGACY));
        assertEquals("Mon Aug 5 20:26:32.095", TimestampFormatter.format(ts, TimestampFormat.CTIME));
        assertEquals("2013-08-05T10:26:32.095Z", TimestampFormatter.format(ts, TimestampFormat.ISO8601_UTC));
        assertEquals("2013-08-05T20:26:32.095+10:00", TimestampFormatter.format(ts, TimestampFormat.ISO8601_LOCAL));
    }

    @Test
    public void testNoneIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TimestampFormatter.format(ts, TimestampFormat.NONE));
    }

    @Test
    public void testEveryFormatParsesBack() {
        RecordParser parser = new RecordParser(ParserConfig.forYear(2013));
        OffsetDateTime utc = OffsetDateTime.of(2013, 8, 5, 20, 26, 32, 95_000_000, ZoneOffset.UTC);

        for (TimestampFormat format : new TimestampFormat[] { TimestampFormat.CTIME, TimestampFormat.ISO8601_UTC,
                TimestampFormat.ISO8601_LOCAL }) {
            ParsedRecord record = parser.parse(TimestampFormatter.format(utc, format) + " [conn1] x");
            assertTrue(utc.isEqual(record.getTimestamp()), format.getLabel());
            assertEquals(format, record.getTimestampFormat());
        }
        ParsedRecord legacy = parser.parse(TimestampFormatter.format(utc, TimestampFormat.CTIME_LEGACY) + " [conn1] x");
        assertEquals(utc.withNano(0), legacy.getTimestamp());
        assertEquals(TimestampFormat.CTIME_LEGACY, legacy.getTimestampFormat());
    }

    @Test
    public void testFindByLabel() {
        assertEquals(TimestampFormat.CTIME_LEGACY, TimestampFormat.findByLabel("ctime-pre2.4"));
        assertEquals(TimestampFormat.ISO8601_LOCAL, TimestampFormat.findByLabel("iso8601-local"));
        assertNull(TimestampFormat.findByLabel("rfc822"));
    }
}
