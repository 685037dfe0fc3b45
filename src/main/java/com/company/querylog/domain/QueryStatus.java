package com.company.querylog.domain;

import com.company.querylog.domain.enums.QueryStatusKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Outcome of a DNS query: a known kind, or {@link QueryStatusKind#UNKNOWN} carrying the raw
 * upstream string. The raw value is always kept so new upstream statuses round-trip unchanged.
 */
@Getter
@EqualsAndHashCode
public final class QueryStatus {

    private final QueryStatusKind kind;
    private final String raw;

    private QueryStatus(QueryStatusKind kind, String raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static QueryStatus of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Status must not be null");
        }
        return new QueryStatus(QueryStatusKind.fromWireName(raw), raw);
    }

    public static QueryStatus of(QueryStatusKind kind) {
        if (kind == QueryStatusKind.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN status needs its raw value");
        }
        return new QueryStatus(kind, kind.getWireName());
    }

    public boolean isBlocked() {
        return kind.isFiltered();
    }

    public boolean isKnown() {
        return kind != QueryStatusKind.UNKNOWN;
    }

    @Override
    public String toString() {
        return raw;
    }
}
