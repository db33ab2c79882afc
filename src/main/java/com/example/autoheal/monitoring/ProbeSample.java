package com.example.autoheal.monitoring;

public record ProbeSample(String component, String metric, double value) {
}
