package com.company.querylog.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of query-log entries, in the upstream's {@code {"data": [...]}} envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestBatchRequest {

    @NotNull(message = "data is required")
    @Size(max = 10000, message = "At most 10000 events per batch")
    private List<RawQueryEvent> data;
}
