package com.company.querylog.domain;

/**
 * A key of a ranked dimension (domain or client) with its occurrence count.
 */
public record RankedEntry(String key, long count) {
}
