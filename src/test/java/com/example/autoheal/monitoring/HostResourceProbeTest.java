package com.example.autoheal.monitoring;

import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HostResourceProbeTest {

    private final AutohealProperties.HealthConfig config = new AutohealProperties.HealthConfig();

    @Test
    void thresholdsPickIssueType() {
        assertThat(HostResourceProbe.evaluate(config, 50, 40)).isEmpty();
        assertThat(HostResourceProbe.evaluate(config, 88, 40))
                .extracting(DetectedIssue::issueType).containsExactly("high_disk");
        assertThat(HostResourceProbe.evaluate(config, 97, 40))
                .extracting(DetectedIssue::issueType).containsExactly("disk_full");
    }

    @Test
    void memoryPressureIsReportedAlongsideDisk() {
        List<DetectedIssue> issues = HostResourceProbe.evaluate(config, 96, 93);

        assertThat(issues).extracting(DetectedIssue::issueType).containsExactly("disk_full", "high_memory");
        assertThat(issues.get(0).severity()).isEqualTo(Issue.Severity.CRITICAL);
        assertThat(issues.get(0).component()).isEqualTo("localhost");
        assertThat(issues.get(0).metrics()).containsEntry("path", "/");
    }

    @Test
    void unknownUsageReportsNothing() {
        assertThat(HostResourceProbe.evaluate(config, -1, -1)).isEmpty();
    }
}
