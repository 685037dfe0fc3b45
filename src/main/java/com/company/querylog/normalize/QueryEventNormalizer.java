package com.company.querylog.normalize;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.QueryStatus;
import com.company.querylog.dto.request.RawQueryEvent;
import com.company.querylog.exception.MalformedEventException;
import com.company.querylog.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Locale;

/**
 * Converts wire entries into {@link QueryEvent}s. Every rejected field raises
 * {@link MalformedEventException}; nothing is coerced to a default value.
 */
@Component
public class QueryEventNormalizer {

    public QueryEvent normalize(RawQueryEvent raw) {
        if (raw == null) {
            throw new MalformedEventException("event", "is null");
        }

        RawQueryEvent.Question question = raw.getQuestion();
        if (question == null) {
            throw new MalformedEventException("question", "is missing");
        }

        String domain = normalizeDomain(question.getName());
        String client = requireText("client", raw.getClient());
        Instant timestamp = parseTimestamp(raw.getTime());
        double elapsedMs = parseElapsedMs(raw.getElapsedMs());
        QueryStatus status = resolveStatus(raw.getStatus(), raw.getReason());

        return QueryEvent.builder()
                .timestamp(timestamp)
                .domain(domain)
                .queryType(question.getType() == null ? "" : question.getType().trim())
                .client(client)
                .elapsedMs(elapsedMs)
                .status(status)
                .reason(raw.getReason() != null ? raw.getReason() : status.getRaw())
                .upstream(raw.getUpstream())
                .rule(raw.getRule())
                .filterId(raw.getFilterId())
                .build();
    }

    /**
     * Reads a JSON number or a numeric string. {@code 123.45} and {@code "123.45"} give the same value.
     */
    public static double parseElapsedMs(Object value) {
        if (value == null) {
            throw new MalformedEventException("elapsedMs", "is missing");
        }

        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof String text) {
            if (text.isBlank()) {
                throw new MalformedEventException("elapsedMs", "is blank");
            }
            try {
                parsed = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new MalformedEventException("elapsedMs", "is not numeric: '" + text + "'", e);
            }
        } else {
            throw new MalformedEventException("elapsedMs",
                    "has unsupported type " + value.getClass().getSimpleName());
        }

        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new MalformedEventException("elapsedMs", "is not finite: " + value);
        }
        if (parsed < 0) {
            throw new MalformedEventException("elapsedMs", "is negative: " + value);
        }
        return parsed;
    }

    static Instant parseTimestamp(String time) {
        if (time == null || time.isBlank()) {
            throw new MalformedEventException("time", "is missing");
        }
        try {
            return TimeUtils.parseIsoInstant(time);
        } catch (DateTimeException e) {
            throw new MalformedEventException("time", "is not ISO-8601: '" + time + "'", e);
        }
    }

    static String normalizeDomain(String name) {
        if (name == null || name.isBlank()) {
            throw new MalformedEventException("question.name", "is empty");
        }
        String domain = name.trim().toLowerCase(Locale.ROOT);
        if (domain.endsWith(".")) {
            domain = domain.substring(0, domain.length() - 1);
        }
        if (domain.isEmpty()) {
            throw new MalformedEventException("question.name", "is empty");
        }
        return domain;
    }

    /**
     * Upstream puts the filtering outcome in "status" or in "reason" (with the DNS response
     * code in "status"). A recognized value wins, status first; otherwise the raw status is kept.
     */
    static QueryStatus resolveStatus(String status, String reason) {
        QueryStatus fromStatus = status == null || status.isBlank() ? null : QueryStatus.of(status.trim());
        QueryStatus fromReason = reason == null || reason.isBlank() ? null : QueryStatus.of(reason.trim());

        if (fromStatus != null && fromStatus.isKnown()) {
            return fromStatus;
        }
        if (fromReason != null && fromReason.isKnown()) {
            return fromReason;
        }
        if (fromStatus != null) {
            return fromStatus;
        }
        if (fromReason != null) {
            return fromReason;
        }
        throw new MalformedEventException("status", "is missing");
    }

    private static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedEventException(field, "is missing");
        }
        return value;
    }
}
