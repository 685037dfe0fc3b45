package com.company.querylog.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one ingestion batch.
 */
@Value
@Builder
public class IngestionResult {

    int accepted;
    int rejected;
    int evicted;

    // Id of the newest accepted event, 0 when none was accepted
    long lastEventId;

    @Builder.Default
    List<Rejection> rejections = List.of();

    public record Rejection(int index, String message) {
    }
}
