package com.example.autoheal.trend;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrendDetectorTest {

    private MutableClock clock;
    private TrendDetector detector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-10T12:00:00Z"));
        detector = new TrendDetector(new AutohealProperties(), clock);
    }

    @Test
    void risingDiskUsagePredictsDiskFull() {
        hourly("db-01", TrendDetector.DISK_USAGE, 30, i -> 60.0 + i);

        Prediction prediction = detector.predictDiskFull("db-01").orElseThrow();

        assertThat(prediction.type()).isEqualTo(Prediction.Type.DISK_FULL);
        assertThat(prediction.hoursUntil()).isCloseTo(6.0, within(0.01));
        assertThat(prediction.severity()).isEqualTo(Issue.Severity.CRITICAL);
        assertThat(prediction.predictedTime()).isAfter(clock.instant());
        assertThat(prediction.supportingData()).containsEntry("current_usage", 89.0);
    }

    @Test
    void flatOrFallingDiskUsageHasNoForecast() {
        hourly("flat", TrendDetector.DISK_USAGE, 30, i -> 70.0);
        hourly("falling", TrendDetector.DISK_USAGE, 30, i -> 90.0 - i);

        assertThat(detector.predictDiskFull("flat")).isEmpty();
        assertThat(detector.predictDiskFull("falling")).isEmpty();
        assertThat(detector.trend("flat", TrendDetector.DISK_USAGE).orElseThrow().direction())
                .isEqualTo(Trend.Direction.STABLE);
    }

    @Test
    void tooFewSamplesHaveNoTrend() {
        hourly("db-01", TrendDetector.DISK_USAGE, 23, i -> 60.0 + i);

        assertThat(detector.trend("db-01", TrendDetector.DISK_USAGE)).isEmpty();
        assertThat(detector.predictDiskFull("db-01")).isEmpty();
    }

    @Test
    void memoryGrowthPredictsExhaustion() {
        hourly("api", TrendDetector.MEMORY_USAGE, 30, i -> 50.0 + 0.5 * i);

        Prediction prediction = detector.predictMemoryExhaustion("api").orElseThrow();

        assertThat(prediction.hoursUntil()).isCloseTo(51.0, within(0.01));
        assertThat(prediction.severity()).isEqualTo(Issue.Severity.INFO);
        assertThat(prediction.confidence()).isEqualTo(Prediction.Confidence.MEDIUM);
        assertThat(prediction.isActionable()).isFalse();
        assertThat(prediction.type().issueType()).isEqualTo("predicted_memory_exhaustion");
    }

    @Test
    void forecastBeyondHorizonIsDropped() {
        hourly("db-01", TrendDetector.DISK_USAGE, 30, i -> 0.11 * i);

        assertThat(detector.predictDiskFull("db-01")).isEmpty();
    }

    @Test
    void regularFailuresPredictNextOne() {
        Instant now = clock.instant();
        List<Instant> failures = List.of(
                now.minus(Duration.ofHours(60)),
                now.minus(Duration.ofHours(36)),
                now.minus(Duration.ofHours(12)));

        Prediction prediction = detector.predictServiceFailure("api", failures).orElseThrow();

        assertThat(prediction.type()).isEqualTo(Prediction.Type.SERVICE_FAILURE);
        assertThat(prediction.predictedTime()).isEqualTo(now.plus(Duration.ofHours(12)));
        assertThat(prediction.confidence()).isEqualTo(Prediction.Confidence.HIGH);
        assertThat(prediction.severity()).isEqualTo(Issue.Severity.WARNING);
        assertThat(prediction.supportingData()).containsEntry("recent_failures", 3);
    }

    @Test
    void twoFailuresAreNotEnough() {
        Instant now = clock.instant();

        assertThat(detector.predictServiceFailure("api",
                List.of(now.minus(Duration.ofHours(30)), now.minus(Duration.ofHours(6))))).isEmpty();
    }

    @Test
    void oldFailuresAreIgnored() {
        Instant now = clock.instant();
        List<Instant> failures = List.of(
                now.minus(Duration.ofDays(20)),
                now.minus(Duration.ofDays(10)),
                now.minus(Duration.ofHours(30)),
                now.minus(Duration.ofHours(6)));

        assertThat(detector.predictServiceFailure("api", failures)).isEmpty();
    }

    @Test
    void overdueFailureIsNotForecast() {
        Instant now = clock.instant();
        List<Instant> failures = List.of(
                now.minus(Duration.ofHours(50)),
                now.minus(Duration.ofHours(45)),
                now.minus(Duration.ofHours(40)));

        assertThat(detector.predictServiceFailure("api", failures)).isEmpty();
    }

    @Test
    void spikeIsReportedAsOutlierAndStep() {
        hourly("web-1", TrendDetector.CPU_USAGE, 29, i -> i % 2 == 0 ? 50.0 : 51.0);
        detector.addSample("web-1", TrendDetector.CPU_USAGE, 100.0, clock.instant().plusSeconds(60));

        List<Anomaly> anomalies = detector.detectAnomalies("web-1", TrendDetector.CPU_USAGE);

        assertThat(anomalies).extracting(Anomaly::kind).containsExactly(Anomaly.Kind.OUTLIER, Anomaly.Kind.STEP);
        assertThat(anomalies.get(0).value()).isEqualTo(100.0);
    }

    @Test
    void steadySeriesHasNoAnomalies() {
        hourly("web-1", TrendDetector.CPU_USAGE, 30, i -> 40.0);

        assertThat(detector.detectAnomalies("web-1", TrendDetector.CPU_USAGE)).isEmpty();
    }

    @Test
    void samplesOutsideHistoryWindowArePruned() {
        Instant now = clock.instant();
        detector.addSample("db-01", TrendDetector.DISK_USAGE, 50.0, now.minus(Duration.ofDays(8)));
        detector.addSample("db-01", TrendDetector.DISK_USAGE, 55.0, now.minus(Duration.ofDays(1)));

        assertThat(detector.samples("db-01", TrendDetector.DISK_USAGE)).hasSize(1);

        clock.advance(Duration.ofDays(7));
        assertThat(detector.samples("db-01", TrendDetector.DISK_USAGE)).isEmpty();
    }

    @Test
    void lateSamplesAreInsertedInOrder() {
        Instant now = clock.instant();
        detector.addSample("db-01", TrendDetector.DISK_USAGE, 3.0, now);
        detector.addSample("db-01", TrendDetector.DISK_USAGE, 1.0, now.minus(Duration.ofHours(2)));
        detector.addSample("db-01", TrendDetector.DISK_USAGE, 2.0, now.minus(Duration.ofHours(1)));

        assertThat(detector.samples("db-01", TrendDetector.DISK_USAGE))
                .extracting(MetricSample::value)
                .containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void invalidSamplesAreRejected() {
        assertThatThrownBy(() -> detector.addSample("db-01", TrendDetector.DISK_USAGE, Double.NaN, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.addSample(null, TrendDetector.DISK_USAGE, 1.0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyzeAllCoversSeriesAndFailureHistories() {
        hourly("db-01", TrendDetector.DISK_USAGE, 30, i -> 60.0 + i);
        Instant now = clock.instant();
        Map<String, List<Instant>> failures = Map.of("api", List.of(
                now.minus(Duration.ofHours(60)), now.minus(Duration.ofHours(36)), now.minus(Duration.ofHours(12))));

        List<Prediction> predictions = detector.analyzeAll(failures);

        assertThat(predictions).extracting(Prediction::type)
                .containsExactlyInAnyOrder(Prediction.Type.DISK_FULL, Prediction.Type.SERVICE_FAILURE);
        Optional<Prediction> disk = predictions.stream().filter(p -> p.type() == Prediction.Type.DISK_FULL).findFirst();
        assertThat(disk).get().extracting(Prediction::component).isEqualTo("db-01");
    }

    // samples end at the current instant, one per hour
    private void hourly(String component, String metric, int count, IntToDoubleFunction value) {
        Instant now = clock.instant();
        for (int i = 0; i < count; i++) {
            detector.addSample(component, metric, value.applyAsDouble(i), now.minus(Duration.ofHours(count - 1 - i)));
        }
    }
}
