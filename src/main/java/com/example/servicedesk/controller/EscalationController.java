package com.example.servicedesk.controller;

import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.escalation.EscalationManager;
import com.example.servicedesk.service.NotificationConfigService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Escalation Rule and Escalation Instance REST API Controller.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EscalationController {

    private final NotificationConfigService configService;
    private final EscalationManager escalationManager;

    // Escalation rule endpoints
    @GetMapping("/escalation-rules")
    public ResponseEntity<List<EscalationRule>> listRules() {
        return ResponseEntity.ok(configService.listEscalationRules());
    }

    @GetMapping("/escalation-rules/{id}")
    public ResponseEntity<EscalationRule> getRule(@PathVariable String id) {
        return ResponseEntity.ok(configService.getEscalationRule(id));
    }

    @PostMapping("/escalation-rules")
    public ResponseEntity<EscalationRule> createRule(@RequestBody EscalationRule rule,
                                                     @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(configService.createEscalationRule(rule, Actors.orDefault(actor)));
    }

    @PutMapping("/escalation-rules/{id}")
    public ResponseEntity<EscalationRule> updateRule(@PathVariable String id, @RequestBody EscalationRule rule,
                                                     @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        return ResponseEntity.ok(configService.updateEscalationRule(id, rule, Actors.orDefault(actor)));
    }

    @DeleteMapping("/escalation-rules/{id}")
    public ResponseEntity<Map<String, String>> deleteRule(@PathVariable String id,
                                                          @RequestHeader(value = Actors.HEADER, required = false) String actor) {
        configService.deleteEscalationRule(id, Actors.orDefault(actor));
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    // Escalation instance endpoints
    @GetMapping("/escalations")
    public ResponseEntity<List<EscalationInstance>> listInstances(@RequestParam(required = false) String subjectId) {
        if (subjectId != null) {
            return ResponseEntity.ok(escalationManager.getInstancesForSubject(subjectId));
        }
        return ResponseEntity.ok(escalationManager.getActiveInstances());
    }

    @GetMapping("/escalations/{id}")
    public ResponseEntity<EscalationInstance> getInstance(@PathVariable String id) {
        return ResponseEntity.ok(escalationManager.getInstance(id));
    }

    @PostMapping("/escalations/trigger")
    public ResponseEntity<EscalationInstance> trigger(@RequestBody Map<String, String> body) {
        String ruleId = body.get("ruleId");
        String subjectId = body.get("subjectId");
        if (ruleId == null || subjectId == null) {
            throw new IllegalArgumentException("ruleId and subjectId are required");
        }
        return ResponseEntity.ok(escalationManager.trigger(ruleId, subjectId, body.get("notificationId")));
    }

    @PostMapping("/escalations/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id,
                                                      @RequestBody(required = false) Map<String, String> body) {
        String reason = body != null ? body.get("reason") : null;
        boolean cancelled = escalationManager.cancel(id, reason);
        return ResponseEntity.ok(Map.of(
                "id", id,
                "cancelled", cancelled,
                "status", escalationManager.getInstance(id).getStatus()));
    }
}
