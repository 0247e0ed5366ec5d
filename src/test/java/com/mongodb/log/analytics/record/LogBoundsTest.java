package com.mongodb.log.analytics.record;

import static org.junit.jupiter.api.Assertions.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.mongodb.log.analytics.MalformedInputException;

public class LogBoundsTest {

    @Test
    public void testBounds() {
        List<String> lines = List.of(
                "***** SERVER RESTARTED *****",
                "Mon Aug  5 20:00:00.000 [initandlisten] MongoDB starting",
                "   continuation",
                "Mon Aug  5 21:30:00.000 [conn1] end connection");

        LogBounds bounds = LogBounds.scan(lines.iterator(), ParserConfig.forYear(2013));

        assertEquals(OffsetDateTime.of(2013, 8, 5, 20, 0, 0, 0, ZoneOffset.UTC), bounds.getStart());
        assertEquals(OffsetDateTime.of(2013, 8, 5, 21, 30, 0, 0, ZoneOffset.UTC), bounds.getEnd());
        assertFalse(bounds.hasYearRollover());
        assertEquals(4, bounds.getLineCount());
    }

    @Test
    public void testYearRollover() {
        List<String> lines = List.of(
                "Tue Dec 31 23:00:00.000 [conn1] a",
                "Wed Jan  1 01:00:00.000 [conn1] b");

        LogBounds bounds = LogBounds.scan(lines.iterator(), ParserConfig.forYear(2014));

        assertTrue(bounds.hasYearRollover());
        assertEquals(OffsetDateTime.of(2013, 12, 31, 23, 0, 0, 0, ZoneOffset.UTC), bounds.getStart());
        assertEquals(OffsetDateTime.of(2014, 1, 1, 1, 0, 0, 0, ZoneOffset.UTC), bounds.getRolloverThreshold());

        RecordParser parser = new RecordParser(bounds.parserConfig(ParserConfig.forYear(2014)));
        assertEquals(bounds.getStart(), parser.parse(lines.get(0)).getTimestamp());
        assertEquals(bounds.getEnd(), parser.parse(lines.get(1)).getTimestamp());
    }

    @Test
    public void testNoTimestampInFirstLines() {
        List<String> lines = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k",
                "Mon Aug  5 20:00:00.000 [conn1] late");

        assertThrows(MalformedInputException.class,
                () -> LogBounds.scan(lines.iterator(), ParserConfig.forYear(2013)));
    }
}
