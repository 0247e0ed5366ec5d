package com.mongodb.log.analytics.grouping;

import java.util.List;

/**
 * One reporting row: a group key, its records and the statistics of the selected field.
 */
public final class GroupResult<K, T> {

    private final K key;
    private final List<T> records;
    private final GroupStatistics statistics;

    public GroupResult(K key, List<T> records, GroupStatistics statistics) {
        this.key = key;
        this.records = records;
        this.statistics = statistics;
    }

    public K getKey() {
        return key;
    }

    public List<T> getRecords() {
        return records;
    }

    public GroupStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return key + ": " + records.size() + " records, " + statistics;
    }
}
