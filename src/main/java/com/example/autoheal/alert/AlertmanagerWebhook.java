package com.example.autoheal.alert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Alertmanager webhook envelope (version 4).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertmanagerWebhook {

    private String version;
    private String groupKey;
    private String status;
    private String receiver;
    private Map<String, String> groupLabels = new HashMap<>();
    private Map<String, String> commonLabels = new HashMap<>();
    private Map<String, String> commonAnnotations = new HashMap<>();
    private String externalURL;
    private List<AlertPayload> alerts = new ArrayList<>();
}
