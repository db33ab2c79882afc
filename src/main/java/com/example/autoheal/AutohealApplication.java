package com.example.autoheal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Autoheal - alert lifecycle and risk-tiered remediation engine.
 *
 * Sits between noisy monitoring signals and disruptive remediation actions:
 * - Alert intake → Alertmanager webhooks and health sweeps, deduplicated by fingerprint
 * - Risk classification → diagnosis oracle with a static fallback table
 * - Remediation gate → per-target cooldowns and a global hourly rate limit
 * - Approval workflow → human sign-off for anything that is not low risk
 * - Outcome tracking → history that feeds the trend and failure forecaster
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class AutohealApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         Autoheal Remediation Engine v0.1.0       ║
            ║         Alert intake: /api/alerts/webhook        ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(AutohealApplication.class, args);
    }
}
