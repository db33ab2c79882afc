package com.example.autoheal.trend;

import java.time.Instant;

public record MetricSample(Instant timestamp, double value) {
}
