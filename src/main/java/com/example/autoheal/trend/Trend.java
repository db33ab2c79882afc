package com.example.autoheal.trend;

import java.time.Instant;

/**
 * Least-squares trend over a metric series.
 *
 * @param slope      units per hour
 * @param volatility population standard deviation of the values
 */
public record Trend(String component,
                    String metric,
                    double slope,
                    double volatility,
                    Direction direction,
                    double current,
                    double mean,
                    int sampleCount,
                    Instant firstSampleAt,
                    Instant lastSampleAt) {

    public enum Direction {
        INCREASING, DECREASING, STABLE
    }
}
