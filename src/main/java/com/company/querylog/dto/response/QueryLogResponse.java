package com.company.querylog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryLogResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private List<QueryLogEntryResponse> data;

    // Matches before pagination
    private long total;

    // Pass back as snapshotId to page through the same set of events
    @JsonProperty("snapshot_id")
    private long snapshotId;

    // Timestamp of the last row on this page, null when the page is empty
    private String oldest;
}
