package com.company.querylog.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.io.Serializable;

/**
 * One query-log row, mirroring the upstream entry format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryLogEntryResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private long id;
    private Question question;
    private String client;
    private String status;
    private String reason;
    private boolean blocked;

    // ISO-8601 instant
    private String time;

    // Decimal string with three fractional digits, as upstream sends it
    private String elapsedMs;

    private String upstream;
    private String rule;
    private Long filterId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Question implements Serializable {
        private static final long serialVersionUID = 1L;

        private String name;
        private String type;
    }
}
