package com.example.autoheal.alert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A single alert as posted by Prometheus Alertmanager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertPayload {

    /** firing or resolved */
    private String status;

    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    @Builder.Default
    private Map<String, String> annotations = new HashMap<>();

    private Instant startsAt;

    private Instant endsAt;

    private String generatorURL;

    private String fingerprint;

    public boolean isResolved() {
        return "resolved".equalsIgnoreCase(status);
    }
}
