package com.company.querylog.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A query-log entry as it arrives on the wire. Fields are validated by the normalizer,
 * not by bean validation, so one bad entry never fails a whole batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawQueryEvent {

    private Question question;
    private String client;

    // ISO-8601
    private String time;

    // JSON number or numeric string, e.g. 123.45 or "123.45"
    private Object elapsedMs;

    private String status;
    private String reason;
    private String upstream;
    private String rule;
    private Long filterId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Question {
        private String name;
        private String type;

        @JsonProperty("class")
        private String questionClass;
    }
}
