package com.company.querylog.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Slowest observed lookup for a domain together with its highest elapsed times.
 */
@Value
@Builder
public class SlowestQuery {

    String domain;
    double elapsedMs;
    String client;
    String reason;

    // Highest elapsed values for the domain, descending
    List<Double> occurrences;
}
