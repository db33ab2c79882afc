package com.example.autoheal.trend;

import java.time.Instant;

/**
 * @param kind OUTLIER beyond 3 sigma of the series mean, or STEP for a jump of more than 2 sigma
 */
public record Anomaly(String component, String metric, Kind kind, Instant timestamp, double value,
                      double mean, double stddev) {

    public enum Kind {
        OUTLIER, STEP
    }
}
