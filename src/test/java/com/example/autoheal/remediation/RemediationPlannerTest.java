package com.example.autoheal.remediation;

import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction.RemediationType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationPlannerTest {

    private final RemediationPlanner planner = new RemediationPlanner();

    @Test
    void stoppedContainerIsRestartedByName() {
        Issue issue = issue("container_stopped", "host-1");
        issue.getMetrics().put("container", "nginx");

        RemediationPlan plan = planner.plan(issue).orElseThrow();

        assertThat(plan.type()).isEqualTo(RemediationType.CONTAINER_RESTART);
        assertThat(plan.target()).isEqualTo("container:nginx");
    }

    @Test
    void containerFallsBackToComponent() {
        assertThat(planner.plan(issue("container_unhealthy", "redis")).orElseThrow().target())
                .isEqualTo("container:redis");
    }

    @Test
    void diskIssuesCleanUpPath() {
        RemediationPlan plan = planner.plan(issue("disk_full", "db-01")).orElseThrow();
        assertThat(plan.type()).isEqualTo(RemediationType.DISK_CLEANUP);
        assertThat(plan.target()).isEqualTo("db-01:/var/log");

        Issue withPath = issue("high_disk", "db-01");
        withPath.getMetrics().put("path", "/data");
        assertThat(planner.plan(withPath).orElseThrow().target()).isEqualTo("db-01:/data");
    }

    @Test
    void serviceAndMemoryPlans() {
        assertThat(planner.plan(issue("service_stopped", "api")).orElseThrow().target()).isEqualTo("service:api");
        assertThat(planner.plan(issue("daemon_unhealthy", "host-1")).orElseThrow().target()).isEqualTo("service:docker");
        assertThat(planner.plan(issue("predicted_memory_exhaustion", "api")).orElseThrow().type())
                .isEqualTo(RemediationType.RESOURCE_SCALE);
        assertThat(planner.plan(issue("log_volume", "api")).orElseThrow().type())
                .isEqualTo(RemediationType.LOG_ROTATION);
    }

    @Test
    void unknownTypeHasNoPlan() {
        assertThat(planner.plan(issue("host_down", "edge-7"))).isEmpty();
        assertThat(planner.plan(issue("monitoring_error", "docker"))).isEmpty();
    }

    @Test
    void annotationsOverridePlan() {
        Issue issue = issue("high_latency", "gateway");
        issue.setAnnotations(new HashMap<>(Map.of(
                "autoheal_action", "service-restart",
                "autoheal_target", "service:envoy")));

        RemediationPlan plan = planner.plan(issue).orElseThrow();

        assertThat(plan.type()).isEqualTo(RemediationType.SERVICE_RESTART);
        assertThat(plan.target()).isEqualTo("service:envoy");
    }

    @Test
    void unknownAnnotatedActionIsCustom() {
        Issue issue = issue("high_latency", "gateway");
        issue.getAnnotations().put("autoheal_action", "flush the cache");

        RemediationPlan plan = planner.plan(issue).orElseThrow();

        assertThat(plan.type()).isEqualTo(RemediationType.CUSTOM);
        assertThat(plan.target()).isEqualTo("gateway");
        assertThat(plan.description()).isEqualTo("flush the cache");
    }

    private static Issue issue(String type, String component) {
        return Issue.builder()
                .fingerprint("abc")
                .name(type)
                .issueType(type)
                .component(component)
                .status(Issue.Status.FIRING)
                .severity(Issue.Severity.WARNING)
                .build();
    }
}
