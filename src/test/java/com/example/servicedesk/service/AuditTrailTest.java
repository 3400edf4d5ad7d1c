package com.example.servicedesk.service;

import com.example.servicedesk.domain.AuditLog;
import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.EscalationCondition;
import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.FilterAction;
import com.example.servicedesk.domain.FilterCondition;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.repository.AuditLogRepository;
import com.example.servicedesk.support.EngineIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest extends EngineIntegrationTest {

    @Autowired
    private NotificationIngestionService ingestionService;

    @Autowired
    private NotificationConfigService configService;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @BeforeEach
    void clearAudit() {
        auditLogRepository.deleteAll();
    }

    private List<String> actionsFor(String target) {
        return auditLogRepository.findByTargetOrderByTimestampDesc(target).stream()
                .map(AuditLog::getAction)
                .toList();
    }

    @Test
    void blockedEventIsAuditedAsNotificationBlocked() {
        configService.createFilterRule(FilterRule.builder()
                .name("Block internal comments")
                .priority(1)
                .action(FilterAction.BLOCK)
                .conditions(new ArrayList<>(List.of(new FilterCondition("type", "equals", "comment_internal"))))
                .build(), "admin");
        NotificationEvent event = event("comment_internal", "T-1", "alice");

        ingestionService.ingest(event);

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(List.of("NOTIFICATION_BLOCKED"), actionsFor(event.getId())));
        AuditLog entry = auditLogRepository.findByTargetOrderByTimestampDesc(event.getId()).get(0);
        assertEquals("filter-engine", entry.getActor());
        assertTrue(entry.getDetails().contains("Block internal comments"));
    }

    @Test
    void startedEscalationIsAuditedAsPending() {
        configService.createEscalationRule(EscalationRule.builder()
                .name("SLA breach")
                .conditions(new ArrayList<>(List.of(
                        new EscalationCondition("event_type", new LinkedHashMap<>(Map.of("types", List.of("sla_breach")))),
                        new EscalationCondition("time_based", new LinkedHashMap<>(Map.of("timeoutMinutes", 2))))))
                .actions(new ArrayList<>(List.of(new EscalationAction("raise_priority", new LinkedHashMap<>()))))
                .maxEscalations(2)
                .cooldownPeriodMinutes(15)
                .build(), "admin");

        ingestionService.ingest(event("sla_breach", "T-4", "alice"));

        List<EscalationInstance> instances = escalationInstanceRepository.findBySubjectIdOrderByTriggeredAtDesc("T-4");
        assertEquals(1, instances.size());
        String instanceId = instances.get(0).getId();
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(List.of("ESCALATION_PENDING"), actionsFor(instanceId)));
        assertEquals("escalation-manager", auditLogRepository.findByTargetOrderByTimestampDesc(instanceId).get(0).getActor());
    }
}
