package com.company.querylog.domain;

import java.time.Duration;

/**
 * How many / how old events the record store keeps.
 *
 * @param maxEvents    evict oldest events beyond this count; 0 disables count-based eviction
 * @param maxAge       evict events older than this; null disables age-based eviction
 * @param hardCapacity when count-based eviction is disabled, reject appends beyond this count; 0 means unbounded
 */
public record RetentionPolicy(long maxEvents, Duration maxAge, long hardCapacity) {

    public RetentionPolicy {
        if (maxEvents < 0 || hardCapacity < 0) {
            throw new IllegalArgumentException("Retention limits must not be negative");
        }
        if (maxAge != null && (maxAge.isNegative() || maxAge.isZero())) {
            throw new IllegalArgumentException("Retention max age must be positive");
        }
    }

    public static RetentionPolicy maxEvents(long maxEvents) {
        return new RetentionPolicy(maxEvents, null, 0);
    }

    public static RetentionPolicy unbounded() {
        return new RetentionPolicy(0, null, 0);
    }

    public boolean evictsBySize() {
        return maxEvents > 0;
    }

    public boolean evictsByAge() {
        return maxAge != null;
    }
}
