package com.mongodb.log.analytics.grouping;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Order statistics over one numeric field of a group. Records where the field is null
 * are left out, so {@link #getCount()} can be lower than the group size.
 */
public class GroupStatistics {

    private final DescriptiveStatistics stats = new DescriptiveStatistics();
    private long recordCount;

    public void addRecord(Number value) {
        recordCount++;
        if (value != null) {
            stats.addValue(value.doubleValue());
        }
    }

    /** Number of records in the group, with or without a value. */
    public long getRecordCount() {
        return recordCount;
    }

    /** Number of records that had a value. */
    public long getCount() {
        return stats.getN();
    }

    public boolean isEmpty() {
        return stats.getN() == 0;
    }

    public double getMin() {
        return isEmpty() ? 0 : stats.getMin();
    }

    public double getMax() {
        return isEmpty() ? 0 : stats.getMax();
    }

    public double getSum() {
        return stats.getSum();
    }

    public double getMean() {
        return isEmpty() ? 0 : stats.getMean();
    }

    /**
     * @param p percentile in (0, 100]
     */
    public double getPercentile(double p) {
        return isEmpty() ? 0 : stats.getPercentile(p);
    }

    @Override
    public String toString() {
        return String.format("count=%d min=%.0f max=%.0f mean=%.1f sum=%.0f", getCount(), getMin(), getMax(),
                getMean(), getSum());
    }
}
