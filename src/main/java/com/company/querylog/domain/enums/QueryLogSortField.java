package com.company.querylog.domain.enums;

import com.company.querylog.domain.QueryEvent;

import java.util.Comparator;

public enum QueryLogSortField {
    TIME("time", Comparator.comparingLong(QueryEvent::getId)),
    ELAPSED_MS("elapsedMs", Comparator.comparingDouble(QueryEvent::getElapsedMs)),
    DOMAIN("domain", Comparator.comparing(QueryEvent::getDomain)),
    CLIENT("client", Comparator.comparing(QueryEvent::getClient)),
    STATUS("status", Comparator.comparing((QueryEvent event) -> event.getStatus().getRaw()));

    private final String paramName;
    private final Comparator<QueryEvent> ascending;

    QueryLogSortField(String paramName, Comparator<QueryEvent> ascending) {
        this.paramName = paramName;
        this.ascending = ascending;
    }

    public String getParamName() {
        return paramName;
    }

    /**
     * Comparator for this field in the requested direction. Equal values fall back to newest first.
     */
    public Comparator<QueryEvent> comparator(boolean descending) {
        Comparator<QueryEvent> primary = descending ? ascending.reversed() : ascending;
        if (this == TIME) {
            return primary;
        }
        return primary.thenComparing(Comparator.comparingLong(QueryEvent::getId).reversed());
    }

    /**
     * Accepts the request parameter name ("elapsedMs") or the constant name ("ELAPSED_MS").
     * Returns null when nothing matches.
     */
    public static QueryLogSortField fromParam(String value) {
        if (value == null || value.isBlank()) {
            return TIME;
        }
        for (QueryLogSortField field : values()) {
            if (field.paramName.equalsIgnoreCase(value) || field.name().equalsIgnoreCase(value)) {
                return field;
            }
        }
        // column id used by the dashboard table
        if ("question/name".equalsIgnoreCase(value)) {
            return DOMAIN;
        }
        return null;
    }
}
