package com.mongodb.log.analytics.record;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@code system.profile} documents into records equivalent to the log line the
 * server would have written for the same operation.
 */
public final class ProfileDocuments {

    private static final Logger logger = LoggerFactory.getLogger(ProfileDocuments.class);

    private static final DateTimeFormatter TS_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private static final String[] PROFILE_COUNTERS = { "nscanned", "ntoreturn", "nupdated", "nreturned",
            "ninserted", "ndeleted" };

    private static final Set<String> COMMAND_ARGUMENTS = Set.of("query", "filter", "sort", "limit", "skip",
            "fields", "projection", "update", "new", "upsert", "remove", "pipeline", "cursor", "key", "$db",
            "lsid", "writeConcern", "readConcern", "maxTimeMS", "hint", "comment", "$readPreference");

    private ProfileDocuments() {
    }

    public static ParsedRecord toRecord(JSONObject doc, RecordParser parser) {
        OffsetDateTime ts = parseTs(doc.opt("ts"));
        String thread = doc.optString("thread", null);
        OpType op = OpType.findByType(doc.optString("op", null));
        String ns = doc.optString("ns", null);

        String command = null;
        if (op == OpType.COMMAND) {
            JSONObject commandDoc = doc.optJSONObject("command");
            if (commandDoc != null) {
                command = commandName(commandDoc);
            }
        }

        String pattern = null;
        String sortPattern = null;
        JSONObject query = doc.optJSONObject("query");
        if (query != null) {
            JSONObject filter = query;
            if (query.optJSONObject("query") != null) {
                filter = query.getJSONObject("query");
            } else if (query.optJSONObject("$query") != null) {
                filter = query.getJSONObject("$query");
            }
            pattern = parser.getNormalizer().normalize(filter.toString());

            JSONObject orderby = query.optJSONObject("orderby");
            if (orderby == null) {
                orderby = query.optJSONObject("$orderby");
            }
            if (orderby != null) {
                sortPattern = parser.getNormalizer().normalize(orderby.toString());
            }
        }

        Long millis = doc.has("millis") ? doc.optLong("millis") : null;

        StringBuilder line = new StringBuilder();
        if (ts != null) {
            line.append(TimestampFormatter.format(ts, TimestampFormat.CTIME)).append(' ');
        }
        line.append('[').append(thread == null ? "" : thread).append(']');
        if (op != null) {
            line.append(' ').append(op.getType());
        }
        if (ns != null) {
            line.append(' ').append(ns);
        }
        if (command != null) {
            line.append(" command: ").append(command);
        }
        if (pattern != null) {
            line.append(" query: ").append(pattern);
        }

        Map<Counter, Long> counters = new EnumMap<>(Counter.class);
        for (String name : PROFILE_COUNTERS) {
            if (doc.has(name)) {
                counters.put(Counter.findByName(name), doc.optLong(name));
                line.append(' ').append(name).append(':').append(doc.optLong(name));
            }
        }
        if (doc.has("numYield")) {
            counters.put(Counter.NUM_YIELDS, doc.optLong("numYield"));
            line.append(" numYields:").append(doc.optLong("numYield"));
        }
        JSONObject lockStats = doc.optJSONObject("lockStats");
        JSONObject timeLocked = lockStats == null ? null : lockStats.optJSONObject("timeLockedMicros");
        if (timeLocked != null) {
            if (timeLocked.has("r")) {
                counters.put(Counter.R, timeLocked.optLong("r"));
            }
            if (timeLocked.has("w")) {
                counters.put(Counter.W, timeLocked.optLong("w"));
            }
        }
        if (millis != null) {
            line.append(' ').append(millis).append("ms");
        }

        ParsedRecord record = ParsedRecord.eager(line.toString(), parser);
        record.setTimestamp(ts, TimestampFormat.CTIME);
        record.setThread(thread);
        record.setOperation(op, ns);
        record.setCommand(command);
        record.setDurationMs(millis);
        record.setPattern(pattern);
        record.setSortPattern(sortPattern);
        record.setPlanSummary(doc.optString("planSummary", null));
        counters.forEach(record::setCounter);
        return record;
    }

    /**
     * JSONObject does not keep key order, so the command name is the first key that is
     * not a common command argument.
     */
    private static String commandName(JSONObject commandDoc) {
        String fallback = null;
        for (String key : commandDoc.keySet()) {
            if (!COMMAND_ARGUMENTS.contains(key)) {
                return key.toLowerCase();
            }
            fallback = key;
        }
        return fallback == null ? null : fallback.toLowerCase();
    }

    private static OffsetDateTime parseTs(Object value) {
        if (value instanceof JSONObject) {
            value = ((JSONObject) value).opt("$date");
        }
        if (value instanceof Number) {
            return OffsetDateTime.ofInstant(Instant.ofEpochMilli(((Number) value).longValue()), ZoneOffset.UTC);
        }
        if (value instanceof String) {
            try {
                TemporalAccessor parsed = TS_FORMAT.parseBest((String) value, OffsetDateTime::from,
                        LocalDateTime::from);
                if (parsed instanceof OffsetDateTime) {
                    return (OffsetDateTime) parsed;
                }
                return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                logger.debug("Unparsable profile ts '{}': {}", value, e.getMessage());
            }
        }
        return null;
    }
}
