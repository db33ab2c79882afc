package com.example.autoheal.trend;

public record SeriesKey(String component, String metric) {
}
