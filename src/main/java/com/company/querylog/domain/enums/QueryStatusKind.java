package com.company.querylog.domain.enums;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum QueryStatusKind {
    OK("OK", false),
    NOT_FILTERED_NOT_FOUND("NotFilteredNotFound", false),
    NOT_FILTERED_WHITE_LIST("NotFilteredWhiteList", false),
    NOT_FILTERED_ERROR("NotFilteredError", false),
    REWRITE("Rewrite", false),
    REWRITE_ETC_HOSTS("RewriteEtcHosts", false),
    REWRITE_RULE("RewriteRule", false),
    FILTERED_BLACK_LIST("FilteredBlackList", true),
    FILTERED_SAFE_BROWSING("FilteredSafeBrowsing", true),
    FILTERED_PARENTAL("FilteredParental", true),
    FILTERED_INVALID("FilteredInvalid", true),
    FILTERED_SAFE_SEARCH("FilteredSafeSearch", true),
    FILTERED_BLOCKED_SERVICE("FilteredBlockedService", true),
    SAFE_BROWSING("SafeBrowsing", true),
    UNKNOWN(null, false);

    private static final Map<String, QueryStatusKind> BY_WIRE_NAME = Arrays.stream(values())
            .filter(kind -> kind.wireName != null)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.wireName, Function.identity()));

    private final String wireName;
    private final boolean filtered;

    QueryStatusKind(String wireName, boolean filtered) {
        this.wireName = wireName;
        this.filtered = filtered;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isFiltered() {
        return filtered;
    }

    /**
     * Exact, case-sensitive lookup. Anything not in the known set maps to {@link #UNKNOWN}.
     */
    public static QueryStatusKind fromWireName(String wireName) {
        if (wireName == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(wireName, UNKNOWN);
    }
}
