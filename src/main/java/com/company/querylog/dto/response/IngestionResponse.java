package com.company.querylog.dto.response;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

    private int accepted;
    private int rejected;
    private int evicted;
    private List<RejectedEvent> errors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectedEvent {
        private int index;
        private String message;
    }
}
