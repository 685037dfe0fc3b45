package com.company.querylog.dto.response;

import lombok.*;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlowestQueryResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String domain;
    private double elapsedMs;
    private String client;
    private String reason;
    private List<Double> occurrences;
}
