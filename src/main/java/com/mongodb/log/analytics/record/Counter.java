package com.mongodb.log.analytics.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numeric {@code name:value} counters found in operation lines. Newer server versions
 * renamed several of them, the new names are registered as aliases.
 */
public enum Counter {
    NSCANNED("nscanned", "keysExamined"),
    NSCANNED_OBJECTS("nscannedObjects", "docsExamined"),
    NTORETURN("ntoreturn"),
    NRETURNED("nreturned", "nMatched"),
    NINSERTED("ninserted", "nInserted"),
    NUPDATED("nupdated", "nModified"),
    NDELETED("ndeleted", "nDeleted"),
    NUM_YIELDS("numYields"),
    WRITE_CONFLICTS("writeConflicts"),
    R("r"),
    W("w");

    private static final Map<String, Counter> BY_NAME;

    static {
        Map<String, Counter> byName = new LinkedHashMap<>();
        for (Counter counter : values()) {
            for (String name : counter.names) {
                byName.put(name, counter);
            }
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String[] names;

    Counter(String... names) {
        this.names = names;
    }

    public String getName() {
        return names[0];
    }

    /**
     * All token prefixes, canonical name first.
     */
    public String[] getNames() {
        return names.clone();
    }

    public static Counter findByName(String name) {
        return BY_NAME.get(name);
    }

    static Map<String, Counter> byName() {
        return BY_NAME;
    }
}
