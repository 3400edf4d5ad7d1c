package com.example.servicedesk.controller;

import com.example.servicedesk.domain.AuditLog;
import com.example.servicedesk.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Audit Trail REST API Controller.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLogs(
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String target,
            @RequestParam(defaultValue = "100") int limit) {
        if (target != null) {
            return ResponseEntity.ok(auditService.getForTarget(target));
        }
        if (action != null) {
            return ResponseEntity.ok(auditService.getByAction(action));
        }
        return ResponseEntity.ok(auditService.getRecent(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "total_blocked_notifications", auditService.countByAction("NOTIFICATION_BLOCKED"),
                "total_batches_flushed", auditService.countByAction("BATCH_FLUSHED"),
                "total_batches_delivered", auditService.countByAction("BATCH_DELIVERED"),
                "total_delivery_failures", auditService.countByAction("BATCH_DELIVERY_FAILED"),
                "total_escalations_completed", auditService.countByAction("ESCALATION_COMPLETED"),
                "total_escalations_failed", auditService.countByAction("ESCALATION_FAILED")
        ));
    }
}
