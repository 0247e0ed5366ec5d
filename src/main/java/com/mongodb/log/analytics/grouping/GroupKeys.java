package com.mongodb.log.analytics.grouping;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mongodb.log.analytics.record.OpType;
import com.mongodb.log.analytics.record.ParsedRecord;

/**
 * Ready-made key functions for {@link Grouping}.
 */
public final class GroupKeys {

    private GroupKeys() {
    }

    /**
     * Key is the first capture group of a regex search over {@code toString()} (the whole
     * match when the pattern has no group), or null when nothing matches.
     */
    public static <T> Function<T, String> regex(Pattern pattern) {
        return item -> {
            Matcher m = pattern.matcher(String.valueOf(item));
            if (!m.find()) {
                return null;
            }
            return m.groupCount() > 0 ? m.group(1) : m.group();
        };
    }

    public static Function<ParsedRecord, String> namespace() {
        return ParsedRecord::getNamespace;
    }

    public static Function<ParsedRecord, String> operation() {
        return record -> {
            OpType op = record.getOperation();
            return op == null ? null : op.getType();
        };
    }

    public static Function<ParsedRecord, String> thread() {
        return ParsedRecord::getThread;
    }

    public static Function<ParsedRecord, String> pattern() {
        return ParsedRecord::getPattern;
    }

    public static Function<ParsedRecord, QueryShapeKey> queryShape() {
        return QueryShapeKey::of;
    }

    /**
     * Looks up a record key function by name: namespace, operation, thread, pattern or
     * shape.
     */
    public static Function<ParsedRecord, ?> byName(String name) {
        switch (name.toLowerCase()) {
        case "namespace":
        case "ns":
            return namespace();
        case "operation":
        case "op":
            return operation();
        case "thread":
            return thread();
        case "pattern":
            return pattern();
        case "shape":
            return queryShape();
        default:
            throw new IllegalArgumentException("Unknown group key '" + name
                    + "', choose from namespace, operation, thread, pattern, shape");
        }
    }
}
