package com.example.autoheal.controller;

import com.example.autoheal.trend.PredictiveAnalysisService;
import com.example.autoheal.trend.Prediction;
import com.example.autoheal.trend.Trend;
import com.example.autoheal.trend.TrendDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metric sample intake and forecasting results.
 */
@RestController
@RequestMapping("/api/trends")
@RequiredArgsConstructor
public class TrendController {

    private final PredictiveAnalysisService predictiveAnalysisService;
    private final TrendDetector trendDetector;

    public record SampleRequest(String component, String metric, Double value, Instant timestamp) {
    }

    @PostMapping("/samples")
    public ResponseEntity<Map<String, Object>> addSamples(@RequestBody List<SampleRequest> samples) {
        int accepted = 0;
        for (SampleRequest s : samples) {
            if (s.component() == null || s.metric() == null || s.value() == null) continue;
            predictiveAnalysisService.recordSample(s.component(), s.metric(), s.value(), s.timestamp());
            accepted++;
        }
        return ResponseEntity.ok(Map.of("received", samples.size(), "accepted", accepted));
    }

    @GetMapping("/{component}/{metric}")
    public ResponseEntity<Trend> getTrend(@PathVariable String component, @PathVariable String metric) {
        return trendDetector.trend(component, metric)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<Prediction>> getPredictions() {
        return ResponseEntity.ok(predictiveAnalysisService.getLatestPredictions());
    }

    @PostMapping("/analyze")
    public ResponseEntity<List<Prediction>> analyze() {
        return ResponseEntity.ok(predictiveAnalysisService.analyze());
    }

    @GetMapping("/report")
    public ResponseEntity<Map<String, Object>> getReport() {
        return ResponseEntity.ok(predictiveAnalysisService.generateReport());
    }
}
