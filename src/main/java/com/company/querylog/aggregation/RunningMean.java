package com.company.querylog.aggregation;

/**
 * Welford-style incremental mean that also supports removing a previously added value.
 * Not thread-safe.
 */
public class RunningMean {

    private long count;
    private double mean;

    public void add(double value) {
        count++;
        mean += (value - mean) / count;
    }

    /**
     * Removes a value that was added before. Removing the last value resets the mean to 0.
     */
    public void remove(double value) {
        if (count == 0) {
            throw new IllegalStateException("Cannot remove from an empty mean");
        }
        if (count == 1) {
            count = 0;
            mean = 0.0;
            return;
        }
        count--;
        mean -= (value - mean) / count;
    }

    public double mean() {
        return count == 0 ? 0.0 : mean;
    }

    public long count() {
        return count;
    }

    public void reset() {
        count = 0;
        mean = 0.0;
    }
}
