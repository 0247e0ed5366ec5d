package com.mongodb.log.analytics.record;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import com.mongodb.log.analytics.MalformedInputException;

public class RecordParserTest {

    static final String QUERY_LINE = "Mon Oct 21 12:14:21.888 [conn4] query test.docs query: { foo: 23432.0 } "
            + "ntoreturn:0 ntoskip:0 nscanned:316776 keyUpdates:0 numYields: 2405 locks(micros) r:743292 "
            + "nreturned:2 reslen:2116 451ms";

    static final String GETMORE_LINE = "Mon Aug  5 20:26:32 [conn9] getmore local.oplog.rs query: "
            + "{ ts: { $gte: new Date(5908578361554239489) } } cursorid:1870634279361287923 ntoreturn:0 "
            + "keyUpdates:0 numYields: 107 locks(micros) r:85093 nreturned:13551 reslen:230387 144ms";

    private final RecordParser parser = new RecordParser(ParserConfig.forYear(2013));

    @Test
    public void testLegacyQueryLine() {
        ParsedRecord record = parser.parse(QUERY_LINE);

        assertEquals(OffsetDateTime.of(2013, 10, 21, 12, 14, 21, 888_000_000, ZoneOffset.UTC), record.getTimestamp());
        assertEquals(TimestampFormat.CTIME, record.getTimestampFormat());
        assertEquals(4, record.getConsumedTokenCount());
        assertEquals("conn4", record.getThread());
        assertEquals("conn4", record.getConnection());
        assertEquals(OpType.QUERY, record.getOperation());
        assertEquals("test.docs", record.getNamespace());
        assertEquals(451L, record.getDurationMs());
        assertEquals(2405L, record.getCounter(Counter.NUM_YIELDS));
        assertEquals(316776L, record.getCounter(Counter.NSCANNED));
        assertEquals(743292L, record.getCounter(Counter.R));
        assertEquals(2L, record.getCounter(Counter.NRETURNED));
        assertEquals(0L, record.getCounter(Counter.NTORETURN));
        assertNull(record.getCounter(Counter.W));
        assertEquals("{\"foo\": 1}", record.getPattern());
        assertNull(record.getSortPattern());
        assertNull(record.getLevel());
    }

    @Test
    public void testSpacedNumYieldsAndDuration() {
        ParsedRecord record = parser.parse("Mon Oct 21 12:14:21.888 [conn1] query test.c query: { a: 1 } "
                + "keyUpdates:0 numYields: 2 locks(micros) r:10 reslen:20 451ms");

        assertEquals(451L, record.getDurationMs());
        assertEquals(2L, record.getCounter(Counter.NUM_YIELDS));
    }

    @Test
    public void testGetmoreLegacyTimestamp() {
        ParsedRecord record = parser.parse(GETMORE_LINE);

        assertEquals(TimestampFormat.CTIME_LEGACY, record.getTimestampFormat());
        assertEquals(OffsetDateTime.of(2013, 8, 5, 20, 26, 32, 0, ZoneOffset.UTC), record.getTimestamp());
        assertEquals(OpType.GETMORE, record.getOperation());
        assertEquals("local.oplog.rs", record.getNamespace());
        assertEquals("{\"ts\": 1}", record.getPattern());
        assertEquals(107L, record.getCounter(Counter.NUM_YIELDS));
        assertEquals(13551L, record.getCounter(Counter.NRETURNED));
        assertEquals(144L, record.getDurationMs());
    }

    @Test
    public void testIsoLocalTimestamp() {
        ParsedRecord record = parser.parse("2013-08-03T21:52:05.095+1000 [initandlisten] db version v2.5.2-pre-");

        assertEquals(TimestampFormat.ISO8601_LOCAL, record.getTimestampFormat());
        assertEquals(OffsetDateTime.of(2013, 8, 3, 21, 52, 5, 95_000_000, ZoneOffset.ofHours(10)),
                record.getTimestamp());
        assertEquals(1, record.getConsumedTokenCount());
        assertEquals("initandlisten", record.getThread());
        assertNull(record.getConnection());
        assertNull(record.getOperation());
        assertNull(record.getNamespace());
        assertNull(record.getDurationMs());
        assertTrue(record.getCounters().isEmpty());
    }

    @Test
    public void testConnectionFromAcceptedLine() {
        ParsedRecord record = parser.parse("Mon Aug  5 20:27:10 [initandlisten] connection accepted from "
                + "127.0.0.1:50778 #16 (15 connections now open)");

        assertEquals("initandlisten", record.getThread());
        assertEquals("conn16", record.getConnection());
    }

    @Test
    public void testLevelAndComponent() {
        ParsedRecord record = parser.parse("2015-03-05T11:12:34.567+0000 I COMMAND  [conn12] command test.$cmd "
                + "command: count { count: \"docs\", query: { a: 5 } } planSummary: COLLSCAN keyUpdates:0 "
                + "writeConflicts:0 numYields:0 reslen:44 locks:{} 12ms");

        assertEquals(TimestampFormat.ISO8601_LOCAL, record.getTimestampFormat());
        assertEquals("I", record.getLevel());
        assertEquals("COMMAND", record.getComponent());
        assertEquals("conn12", record.getThread());
        assertEquals(OpType.COMMAND, record.getOperation());
        assertEquals("test.$cmd", record.getNamespace());
        assertEquals("count", record.getCommand());
        assertEquals("{\"a\": 1}", record.getPattern());
        assertEquals("COLLSCAN", record.getPlanSummary());
        assertEquals(0L, record.getCounter(Counter.WRITE_CONFLICTS));
        assertEquals(0L, record.getCounter(Counter.NUM_YIELDS));
        assertEquals(12L, record.getDurationMs());
    }

    @Test
    public void testFindCommandWithAliasedCounters() {
        ParsedRecord record = parser.parse("2016-01-01T10:00:00.000Z I COMMAND [conn1] command test.coll "
                + "command: find { find: \"coll\", filter: { name: \"x\", age: { $gt: 20 } }, sort: { age: 1 } } "
                + "planSummary: IXSCAN { age: 1 } keysExamined:10 docsExamined:8 nreturned:5 numYields:0 "
                + "reslen:200 5ms");

        assertEquals(TimestampFormat.ISO8601_UTC, record.getTimestampFormat());
        assertEquals("find", record.getCommand());
        assertEquals("{\"age\": 1, \"name\": 1}", record.getPattern());
        assertEquals(10L, record.getCounter(Counter.NSCANNED));
        assertEquals(8L, record.getCounter(Counter.NSCANNED_OBJECTS));
        assertEquals(5L, record.getCounter(Counter.NRETURNED));
        assertEquals(5L, record.getDurationMs());
    }

    @Test
    public void testOldStyleCommandName() {
        ParsedRecord record = parser.parse("Mon Aug  5 20:26:32 [conn1] command admin.$cmd "
                + "command: { replSetGetStatus: 1 } ntoreturn:1 keyUpdates:0 reslen:364 0ms");

        assertEquals(OpType.COMMAND, record.getOperation());
        assertEquals("replsetgetstatus", record.getCommand());
        assertNull(record.getPattern());
        assertEquals(0L, record.getDurationMs());
    }

    @Test
    public void testQueryWithOrderby() {
        ParsedRecord record = parser.parse("Mon Aug  5 20:26:32 [conn3] query test.docs query: "
                + "{ query: { a: 1.0, b: \"x\" }, orderby: { c: -1.0 } } ntoreturn:0 nscanned:4 nreturned:2 "
                + "reslen:100 22ms");

        assertEquals("{\"a\": 1, \"b\": 1}", record.getPattern());
        assertEquals("{\"c\": 1}", record.getSortPattern());
    }

    @Test
    public void testTruncatedLine() {
        ParsedRecord record = parser.parse("Wed Aug  7 10:04:48.123 [conn2] warning: log line attempted (16k) "
                + "over max size(10k), printing beginning and end ... update test.docs query: { _id: 1 } "
                + "update: { $set: { a: 1 } } nscanned:1 nupdated:1 4ms");

        assertEquals("conn2", record.getThread());
        assertEquals(OpType.UPDATE, record.getOperation());
        assertEquals("test.docs", record.getNamespace());
        assertEquals("{\"_id\": 1}", record.getPattern());
        assertEquals(1L, record.getCounter(Counter.NUPDATED));
        assertEquals(4L, record.getDurationMs());
    }

    @Test
    public void testLineWithoutTimestamp() {
        ParsedRecord record = parser.parse("    at some continuation of a previous line 3ms");

        assertNull(record.getTimestamp());
        assertEquals(TimestampFormat.NONE, record.getTimestampFormat());
        assertEquals(0, record.getConsumedTokenCount());
        assertNull(record.getThread());
        assertNull(record.getOperation());
        assertEquals(3L, record.getDurationMs());
    }

    @Test
    public void testTimestampAfterPrefix() {
        ParsedRecord record = parser.parse("{1} " + QUERY_LINE);

        assertEquals(5, record.getConsumedTokenCount());
        assertEquals("conn4", record.getThread());
        assertEquals(OpType.QUERY, record.getOperation());
    }

    @Test
    public void testTimestampBeyondSearchWindowIgnored() {
        ParsedRecord record = parser.parse("a b c d e f g h i j 2013-08-03T21:52:05.095Z [conn1] hello");

        assertNull(record.getTimestamp());
    }

    @Test
    public void testImpossibleDateIsNoTimestamp() {
        ParsedRecord record = parser.parse("Fri Feb 29 10:00:00.000 [conn1] end connection");

        assertNull(record.getTimestamp());
    }

    @Test
    public void testYearRollover() {
        ParserConfig config = ParserConfig.forYear(2014)
                .withRolloverThreshold(OffsetDateTime.of(2014, 1, 2, 0, 0, 0, 0, ZoneOffset.UTC));
        RecordParser rolloverParser = new RecordParser(config);

        assertEquals(2013, rolloverParser.parse("Tue Dec 31 23:59:59.000 [conn1] x").getTimestamp().getYear());
        assertEquals(2014, rolloverParser.parse("Wed Jan  1 00:00:01.000 [conn1] x").getTimestamp().getYear());
    }

    @Test
    public void testOtherDurations() {
        assertEquals(20L, parser.parse("Mon Aug  5 20:26:32 [DataFileSync] flushing mmaps took 20ms  for 5 files")
                .getDurationMs());
        assertEquals(3000L, parser.parse("2018-01-01T00:00:00.000+0000 W STORAGE  [thread1] "
                + "Checkpoint took 3 seconds to complete.").getDurationMs());
        assertEquals(1234L, parser.parse("Mon Aug  5 20:26:32 [conn1] query a.b query: { a: 1 } 1,234ms")
                .getDurationMs());
        assertNull(parser.parse("2018-01-01T00:00:00.000+0000 I REPL [rsBackgroundSync] "
                + "Scheduled new oplog query Fetcher source: h:27017 took 12ms").getDurationMs());
    }

    @Test
    public void testCountersWithThousandsSeparators() {
        ParsedRecord record = parser.parse("Mon Aug  5 20:26:32 [conn1] query a.b query: { a: 1 } "
                + "nscanned:1,234 nreturned:12,000 451ms");

        assertEquals(1234L, record.getCounter(Counter.NSCANNED));
        assertEquals(12000L, record.getCounter(Counter.NRETURNED));
        assertEquals(451L, record.getDurationMs());
    }

    @Test
    public void testReparseIsIdempotent() {
        ParsedRecord first = parser.parse(QUERY_LINE).parseAll();
        ParsedRecord second = parser.parse(first.getRawText()).parseAll();

        assertEquals(first.getTimestamp(), second.getTimestamp());
        assertEquals(first.getTimestampFormat(), second.getTimestampFormat());
        assertEquals(first.getThread(), second.getThread());
        assertEquals(first.getOperation(), second.getOperation());
        assertEquals(first.getNamespace(), second.getNamespace());
        assertEquals(first.getDurationMs(), second.getDurationMs());
        assertEquals(first.getCounters(), second.getCounters());
        assertEquals(first.getPattern(), second.getPattern());
    }

    @Test
    public void testWithTimestampRoundTrip() {
        ParsedRecord record = parser.parse(QUERY_LINE);
        OffsetDateTime later = record.getTimestamp().plusHours(1);

        String rewritten = record.withTimestamp(later);

        assertTrue(rewritten.startsWith("Mon Oct 21 13:14:21.888 [conn4] query test.docs"));
        ParsedRecord reparsed = parser.parse(rewritten);
        assertEquals(later, reparsed.getTimestamp());
        assertEquals(TimestampFormat.CTIME, reparsed.getTimestampFormat());
        assertEquals(451L, reparsed.getDurationMs());
    }

    @Test
    public void testWithTimestampLegacyCtime() {
        ParsedRecord record = parser.parse(GETMORE_LINE);

        String rewritten = record.withTimestamp(record.getTimestamp().plusDays(1));

        assertTrue(rewritten.startsWith("Tue Aug 6 20:26:32 [conn9] getmore"));
    }

    @Test
    public void testMalformedInput() {
        assertThrows(MalformedInputException.class, () -> parser.parse((String) null));
        assertThrows(MalformedInputException.class, () -> parser.parse("   \n"));
        assertThrows(MalformedInputException.class,
                () -> parser.parse(new byte[] { 'a', (byte) 0xC3, (byte) 0x28 }));
        assertNull(parser.tryParse(""));
    }

    @Test
    public void testParseBytes() {
        ParsedRecord record = parser.parse(QUERY_LINE.getBytes(StandardCharsets.UTF_8));

        assertEquals("conn4", record.getThread());
    }

    @Test
    public void testTrailingWhitespaceStripped() {
        assertEquals(QUERY_LINE, parser.parse(QUERY_LINE + "  \n").getRawText());
    }
}
