package com.example.autoheal.risk;

import com.example.autoheal.domain.Issue;

import java.util.Map;

public record Classification(Issue.RiskLevel riskLevel, String suggestedFix, Map<String, Object> metadata) {
}
