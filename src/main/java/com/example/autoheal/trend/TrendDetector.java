package com.example.autoheal.trend;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Deterministic forecasting over metric series and failure histories.
 *
 * <p>Series are kept per (component, metric), ordered by time and pruned to the
 * configured history window on every append and read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendDetector {

    public static final String DISK_USAGE = "disk_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String CPU_USAGE = "cpu_usage";

    static final double STABLE_SLOPE = 0.1;
    static final double DISK_THRESHOLD = 95.0;
    static final double DISK_HORIZON_HOURS = 720;
    static final double MEMORY_THRESHOLD = 90.0;
    static final double MEMORY_HORIZON_HOURS = 168;
    static final int MIN_FAILURES = 3;
    static final Duration FAILURE_WINDOW = Duration.ofDays(7);
    static final Duration FAILURE_HORIZON = Duration.ofDays(30);
    static final int ANOMALY_RECENT = 10;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final AutohealProperties properties;
    private final Clock clock;

    private final Map<SeriesKey, List<MetricSample>> series = new HashMap<>();

    public synchronized void addSample(String component, String metric, double value, Instant timestamp) {
        if (component == null || metric == null) {
            throw new IllegalArgumentException("component and metric are required");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite: " + value);
        }
        Instant ts = timestamp != null ? timestamp : clock.instant();
        List<MetricSample> samples = series.computeIfAbsent(new SeriesKey(component, metric), k -> new ArrayList<>());
        MetricSample sample = new MetricSample(ts, value);
        if (samples.isEmpty() || !samples.get(samples.size() - 1).timestamp().isAfter(ts)) {
            samples.add(sample);
        } else {
            int idx = 0;
            while (idx < samples.size() && !samples.get(idx).timestamp().isAfter(ts)) idx++;
            samples.add(idx, sample);
        }
        prune(samples);
    }

    public synchronized List<MetricSample> samples(String component, String metric) {
        List<MetricSample> samples = series.get(new SeriesKey(component, metric));
        if (samples == null) return List.of();
        prune(samples);
        return List.copyOf(samples);
    }

    public synchronized Set<SeriesKey> seriesKeys() {
        Set<SeriesKey> keys = new TreeSet<>(Comparator.comparing(SeriesKey::component).thenComparing(SeriesKey::metric));
        keys.addAll(series.keySet());
        return keys;
    }

    /**
     * Empty below the minimum sample count.
     */
    public Optional<Trend> trend(String component, String metric) {
        List<MetricSample> samples = samples(component, metric);
        if (samples.size() < properties.getPrediction().getMinDataPoints() || samples.isEmpty()) {
            return Optional.empty();
        }
        Instant first = samples.get(0).timestamp();
        int n = samples.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = Duration.between(first, samples.get(i).timestamp()).toMillis() / 3_600_000.0;
            y[i] = samples.get(i).value();
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            num += (x[i] - meanX) * (y[i] - meanY);
            den += (x[i] - meanX) * (x[i] - meanX);
        }
        double slope = den == 0 ? 0 : num / den;
        Trend.Direction direction = Math.abs(slope) < STABLE_SLOPE ? Trend.Direction.STABLE
                : slope > 0 ? Trend.Direction.INCREASING : Trend.Direction.DECREASING;

        return Optional.of(new Trend(component, metric, slope, stddev(y, meanY), direction,
                y[n - 1], meanY, n, first, samples.get(n - 1).timestamp()));
    }

    public Optional<Prediction> predictDiskFull(String component) {
        return trend(component, DISK_USAGE).flatMap(t -> {
            double hours = hoursToThreshold(t, DISK_THRESHOLD, DISK_HORIZON_HOURS);
            if (hours < 0) return Optional.empty();
            Instant when = clock.instant().plus(Duration.ofMillis((long) (hours * 3_600_000)));
            return Optional.of(new Prediction(
                    Prediction.Type.DISK_FULL, component, when, hours,
                    confidenceFromVolatility(t.volatility(), 2, 5),
                    severityFromHours(hours, 24, 72),
                    String.format("Disk usage at %.1f%%, trending up at %.2f%%/hour", t.current(), t.slope()),
                    "Free up disk space or expand storage before " + DAY.format(when),
                    supportingData(t, "current_usage"),
                    clock.instant()));
        });
    }

    public Optional<Prediction> predictMemoryExhaustion(String component) {
        return trend(component, MEMORY_USAGE).flatMap(t -> {
            double hours = hoursToThreshold(t, MEMORY_THRESHOLD, MEMORY_HORIZON_HOURS);
            if (hours < 0) return Optional.empty();
            Instant when = clock.instant().plus(Duration.ofMillis((long) (hours * 3_600_000)));
            return Optional.of(new Prediction(
                    Prediction.Type.MEMORY_EXHAUSTION, component, when, hours,
                    confidenceFromVolatility(t.volatility(), 3, 7),
                    severityFromHours(hours, 12, 48),
                    String.format("Memory usage at %.1f%%, trending up at %.2f%%/hour", t.current(), t.slope()),
                    "Investigate memory growth or raise limits on " + component + " before " + MINUTE.format(when),
                    supportingData(t, "current_usage"),
                    clock.instant()));
        });
    }

    /**
     * Forecast the next failure of a component from its failure times. Needs at
     * least three failures inside the last seven days (two intervals).
     */
    public Optional<Prediction> predictServiceFailure(String component, List<Instant> failureTimes) {
        if (failureTimes == null || failureTimes.size() < MIN_FAILURES) return Optional.empty();
        Instant now = clock.instant();
        Instant windowStart = now.minus(FAILURE_WINDOW);
        List<Instant> recent = failureTimes.stream()
                .filter(t -> t.isAfter(windowStart))
                .sorted()
                .toList();
        if (recent.size() < MIN_FAILURES) return Optional.empty();

        double[] intervals = new double[recent.size() - 1];
        for (int i = 0; i < intervals.length; i++) {
            intervals[i] = Duration.between(recent.get(i), recent.get(i + 1)).toMillis() / 3_600_000.0;
        }
        double meanInterval = mean(intervals);
        if (meanInterval <= 0) return Optional.empty();
        double stdInterval = stddev(intervals, meanInterval);

        Instant last = recent.get(recent.size() - 1);
        Instant predicted = last.plus(Duration.ofMillis((long) (meanInterval * 3_600_000)));
        if (predicted.isBefore(now) || predicted.isAfter(now.plus(FAILURE_HORIZON))) {
            return Optional.empty();
        }

        Prediction.Confidence confidence = stdInterval < meanInterval * 0.3 ? Prediction.Confidence.HIGH
                : stdInterval < meanInterval * 0.6 ? Prediction.Confidence.MEDIUM
                : Prediction.Confidence.LOW;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("recent_failures", recent.size());
        data.put("avg_interval_hours", round2(meanInterval));
        data.put("std_deviation", round2(stdInterval));
        return Optional.of(new Prediction(
                Prediction.Type.SERVICE_FAILURE, component, predicted,
                Duration.between(now, predicted).toMillis() / 3_600_000.0,
                confidence, Issue.Severity.WARNING,
                String.format("Based on %d recent failures, average interval: %.1fh", recent.size(), meanInterval),
                "Monitor " + component + " closely around " + MINUTE.format(predicted),
                data, now));
    }

    /**
     * Outliers among the last ten samples and a large final step. Informational only.
     */
    public List<Anomaly> detectAnomalies(String component, String metric) {
        List<MetricSample> samples = samples(component, metric);
        if (samples.size() < properties.getPrediction().getMinDataPoints() || samples.size() < 2) {
            return List.of();
        }
        double[] values = samples.stream().mapToDouble(MetricSample::value).toArray();
        double mean = mean(values);
        double std = stddev(values, mean);
        if (std == 0) return List.of();

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = Math.max(0, samples.size() - ANOMALY_RECENT); i < samples.size(); i++) {
            MetricSample s = samples.get(i);
            if (Math.abs(s.value() - mean) > 3 * std) {
                anomalies.add(new Anomaly(component, metric, Anomaly.Kind.OUTLIER, s.timestamp(), s.value(), mean, std));
            }
        }
        MetricSample last = samples.get(samples.size() - 1);
        double step = last.value() - samples.get(samples.size() - 2).value();
        if (Math.abs(step) > 2 * std) {
            anomalies.add(new Anomaly(component, metric, Anomaly.Kind.STEP, last.timestamp(), last.value(), mean, std));
        }
        return anomalies;
    }

    /**
     * Run every forecast over all known series, plus failure forecasts for the
     * given histories. Anomalies are logged, not returned.
     */
    public List<Prediction> analyzeAll(Map<String, List<Instant>> failureHistory) {
        Set<String> components = new TreeSet<>(failureHistory.keySet());
        Set<SeriesKey> keys = seriesKeys();
        keys.forEach(k -> components.add(k.component()));

        List<Prediction> predictions = new ArrayList<>();
        for (String component : components) {
            predictDiskFull(component).ifPresent(predictions::add);
            predictMemoryExhaustion(component).ifPresent(predictions::add);
            predictServiceFailure(component, failureHistory.getOrDefault(component, List.of()))
                    .ifPresent(predictions::add);
        }
        for (SeriesKey key : keys) {
            for (Anomaly anomaly : detectAnomalies(key.component(), key.metric())) {
                log.warn("Anomaly in {}: {} {} = {} (mean {}, stddev {})", anomaly.component(), anomaly.metric(),
                        anomaly.kind(), round2(anomaly.value()), round2(anomaly.mean()), round2(anomaly.stddev()));
            }
        }
        return predictions;
    }

    // -1 when no forecast applies
    private static double hoursToThreshold(Trend trend, double threshold, double horizonHours) {
        if (trend.direction() != Trend.Direction.INCREASING || trend.slope() <= 0) return -1;
        double hours = (threshold - trend.current()) / trend.slope();
        if (hours < 0 || hours > horizonHours) return -1;
        return hours;
    }

    private static Prediction.Confidence confidenceFromVolatility(double volatility, double high, double medium) {
        if (volatility < high) return Prediction.Confidence.HIGH;
        if (volatility < medium) return Prediction.Confidence.MEDIUM;
        return Prediction.Confidence.LOW;
    }

    private static Issue.Severity severityFromHours(double hours, double critical, double warning) {
        if (hours < critical) return Issue.Severity.CRITICAL;
        if (hours < warning) return Issue.Severity.WARNING;
        return Issue.Severity.INFO;
    }

    private static Map<String, Object> supportingData(Trend t, String currentKey) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(currentKey, round2(t.current()));
        data.put("rate_of_increase", round2(t.slope()));
        data.put("volatility", round2(t.volatility()));
        data.put("samples", t.sampleCount());
        return data;
    }

    // caller holds the monitor
    private void prune(List<MetricSample> samples) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getPrediction().getHistoryDays()));
        samples.removeIf(s -> s.timestamp().isBefore(cutoff));
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0 : sum / values.length;
    }

    private static double stddev(double[] values, double mean) {
        if (values.length == 0) return 0;
        double sq = 0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return Math.sqrt(sq / values.length);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
