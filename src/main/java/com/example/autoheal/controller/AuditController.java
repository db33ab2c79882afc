package com.example.autoheal.controller;

import com.example.autoheal.domain.AuditAction;
import com.example.autoheal.domain.AuditLog;
import com.example.autoheal.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the audit trail.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    /**
     * Newest first. 400 for an unknown action name.
     */
    @GetMapping
    public ResponseEntity<List<AuditLog>> search(@RequestParam(required = false) String actor,
                                                 @RequestParam(required = false) String action,
                                                 @RequestParam(required = false) String subject,
                                                 @RequestParam(defaultValue = "100") int limit) {
        if (actor == null && action == null && subject == null) {
            return ResponseEntity.ok(auditService.getRecent(limit));
        }
        Optional<AuditAction> parsed = AuditAction.parse(action);
        if (action != null && parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(auditService.search(actor, parsed.orElse(null), subject, limit));
    }

    @GetMapping("/subject/{subject}")
    public ResponseEntity<List<AuditLog>> forSubject(@PathVariable String subject) {
        return ResponseEntity.ok(auditService.getForSubject(subject));
    }

    @GetMapping("/summary")
    public ResponseEntity<Map<String, Long>> summary(@RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(auditService.summary(Duration.ofHours(Math.max(1, hours))));
    }
}
