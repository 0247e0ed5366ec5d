package com.mongodb.log.analytics.merge;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.LabelCountMismatchException;
import com.mongodb.log.analytics.record.ParsedRecord;
import com.mongodb.log.analytics.record.RecordParser;

/**
 * Chronological k-way merge of log streams. The merge is lazy: each call to
 * {@code next()} reads exactly one line from the stream that was selected.
 */
public class StreamMerger {

    private static final Logger logger = LoggerFactory.getLogger(StreamMerger.class);

    public static final String LABEL_ENUM = "enum";
    public static final String LABEL_ALPHA = "alpha";
    public static final String LABEL_NONE = "none";
    public static final String LABEL_FILENAME = "filename";

    static final OffsetDateTime MIN_TIMESTAMP = OffsetDateTime.of(1, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    public Iterator<MergedLine> merge(List<MergeSource> sources, List<String> labels, List<Integer> timezoneHours) {
        return merge(sources, labels, timezoneHours, LabelPosition.FRONT);
    }

    public Iterator<MergedLine> merge(List<MergeSource> sources, List<String> labels, List<Integer> timezoneHours,
            LabelPosition position) {
        List<String> resolvedLabels = resolveLabels(sources, labels);
        List<Integer> resolvedHours = resolveTimezones(sources.size(), timezoneHours);
        logger.debug("Merging {} streams, labels {}, timezone adjustments {}", sources.size(), resolvedLabels,
                resolvedHours);
        return new MergeIterator(sources, resolvedLabels, resolvedHours, position);
    }

    /**
     * Expands the label argument into one label (or null) per stream.
     *
     * @throws LabelCountMismatchException when neither one label nor one per stream is given
     */
    static List<String> resolveLabels(List<MergeSource> sources, List<String> labels) {
        int n = sources.size();
        List<String> result = new ArrayList<>(n);
        if (labels == null || labels.isEmpty()) {
            return new ArrayList<>(Collections.nCopies(n, null));
        }
        if (labels.size() == 1) {
            String style = labels.get(0);
            for (int i = 0; i < n; i++) {
                switch (style) {
                case LABEL_ENUM:
                    result.add("{" + (i + 1) + "}");
                    break;
                case LABEL_ALPHA:
                    result.add("{" + (char) ('a' + i) + "}");
                    break;
                case LABEL_NONE:
                    result.add(null);
                    break;
                case LABEL_FILENAME:
                    result.add("{" + sources.get(i).getName() + "}");
                    break;
                default:
                    result.add(style);
                }
            }
            return result;
        }
        if (labels.size() == n) {
            result.addAll(labels);
            return result;
        }
        throw new LabelCountMismatchException(labels.size(), n);
    }

    static List<Integer> resolveTimezones(int streamCount, List<Integer> timezoneHours) {
        if (timezoneHours == null || timezoneHours.isEmpty()) {
            return Collections.nCopies(streamCount, 0);
        }
        if (timezoneHours.size() == 1) {
            return Collections.nCopies(streamCount, timezoneHours.get(0));
        }
        if (timezoneHours.size() == streamCount) {
            return List.copyOf(timezoneHours);
        }
        throw new IllegalArgumentException("Invalid number of timezone parameters (" + timezoneHours.size()
                + "), use either one for all streams or one per stream (" + streamCount + ")");
    }

    /**
     * Per-stream cursor: the current line and the timestamp it is ordered by.
     */
    private static final class Cursor {
        final Iterator<String> lines;
        final RecordParser parser;
        final int hours;
        String line;
        ParsedRecord record;
        OffsetDateTime sortKey;

        Cursor(MergeSource source, int hours) {
            this.lines = source.getLines();
            this.parser = new RecordParser(source.getParserConfig());
            this.hours = hours;
        }

        boolean exhausted() {
            return line == null;
        }

        void advance(OffsetDateTime previousSelected) {
            if (!lines.hasNext()) {
                line = null;
                record = null;
                sortKey = null;
                return;
            }
            line = lines.next().stripTrailing();
            record = parser.tryParse(line);
            OffsetDateTime ts = record == null ? null : record.getTimestamp();
            if (ts == null) {
                sortKey = previousSelected;
            } else {
                sortKey = ts.plusHours(hours);
            }
        }
    }

    private static final class MergeIterator implements Iterator<MergedLine> {

        private final List<Cursor> cursors = new ArrayList<>();
        private final List<String> labels;
        private final LabelPosition position;
        private OffsetDateTime lastSelected = MIN_TIMESTAMP;

        MergeIterator(List<MergeSource> sources, List<String> labels, List<Integer> hours, LabelPosition position) {
            this.labels = labels;
            this.position = position;
            for (int i = 0; i < sources.size(); i++) {
                Cursor cursor = new Cursor(sources.get(i), hours.get(i));
                cursor.advance(lastSelected);
                cursors.add(cursor);
            }
        }

        @Override
        public boolean hasNext() {
            for (Cursor cursor : cursors) {
                if (!cursor.exhausted()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public MergedLine next() {
            int selected = -1;
            for (int i = 0; i < cursors.size(); i++) {
                Cursor cursor = cursors.get(i);
                if (cursor.exhausted()) {
                    continue;
                }
                if (selected < 0 || cursor.sortKey.isBefore(cursors.get(selected).sortKey)) {
                    selected = i;
                }
            }
            if (selected < 0) {
                throw new NoSuchElementException();
            }

            Cursor cursor = cursors.get(selected);
            boolean dated = cursor.record != null && cursor.record.getTimestamp() != null;
            String text = cursor.line;
            if (dated && cursor.hours != 0) {
                text = cursor.record.withTimestamp(cursor.sortKey);
            }
            String label = labels.get(selected);
            if (label != null) {
                text = dated ? position.apply(text, label) : LabelPosition.FRONT.apply(text, label);
            }
            MergedLine result = new MergedLine(selected, text, cursor.sortKey);

            lastSelected = cursor.sortKey;
            cursor.advance(lastSelected);
            return result;
        }
    }
}
