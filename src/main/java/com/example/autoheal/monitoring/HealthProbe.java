package com.example.autoheal.monitoring;

import com.example.autoheal.alert.DetectedIssue;

import java.util.List;

/**
 * A source of locally detected issues. Issues a probe stops reporting are
 * resolved by the sweep; a probe that throws is itself reported as an issue.
 */
public interface HealthProbe {

    /** Also used as the source of the issues this probe reports */
    String name();

    List<DetectedIssue> probe() throws Exception;

    /** Metric samples for trend analysis, collected on the same schedule */
    default List<ProbeSample> collectSamples() {
        return List.of();
    }
}
