package com.mongodb.log.analytics.record;

import java.time.OffsetDateTime;
import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.MalformedInputException;
import com.mongodb.log.analytics.time.TimeRange;

/**
 * First and last timestamp of a log stream, found in one scan. When the last timestamp
 * is earlier than the first one the stream crossed a new year: the start is moved back
 * one year and the end becomes the rollover threshold for the next parsing pass.
 */
public final class LogBounds {

    private static final Logger logger = LoggerFactory.getLogger(LogBounds.class);

    static final int START_SEARCH_LINES = 10;

    private final TimeRange range;
    private final OffsetDateTime rolloverThreshold;
    private final long lineCount;

    private LogBounds(TimeRange range, OffsetDateTime rolloverThreshold, long lineCount) {
        this.range = range;
        this.rolloverThreshold = rolloverThreshold;
        this.lineCount = lineCount;
    }

    public static LogBounds scan(Iterator<String> lines, ParserConfig config) {
        RecordParser parser = new RecordParser(config);
        OffsetDateTime start = null;
        OffsetDateTime end = null;
        long count = 0;
        while (lines.hasNext()) {
            String line = lines.next();
            count++;
            OffsetDateTime ts = parser.extractTimestamp(line);
            if (ts == null) {
                continue;
            }
            if (start == null) {
                if (count > START_SEARCH_LINES) {
                    break;
                }
                start = ts;
            }
            end = ts;
        }
        if (start == null) {
            throw new MalformedInputException("Log file does not appear to be a supported MongoDB log file format");
        }

        OffsetDateTime rollover = null;
        if (end.isBefore(start)) {
            logger.debug("Year rollover detected, start {} end {}", start, end);
            start = start.minusYears(1);
            rollover = end;
        }
        return new LogBounds(new TimeRange(start, end), rollover, count);
    }

    public TimeRange getRange() {
        return range;
    }

    public OffsetDateTime getStart() {
        return range.getStart();
    }

    public OffsetDateTime getEnd() {
        return range.getEnd();
    }

    /**
     * @return the end timestamp when the stream crossed a new year, otherwise null
     */
    public OffsetDateTime getRolloverThreshold() {
        return rolloverThreshold;
    }

    public boolean hasYearRollover() {
        return rolloverThreshold != null;
    }

    public long getLineCount() {
        return lineCount;
    }

    /**
     * Config for parsing the scanned stream, carrying the rollover threshold when there is one.
     */
    public ParserConfig parserConfig(ParserConfig base) {
        return rolloverThreshold == null ? base : base.withRolloverThreshold(rolloverThreshold);
    }
}
