package com.example.servicedesk.service;

import com.example.servicedesk.domain.BatchStatus;
import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.EscalationCondition;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.FilterAction;
import com.example.servicedesk.domain.FilterCondition;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.GroupingStrategy;
import com.example.servicedesk.domain.NotificationBatch;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.domain.UserNotificationPreferences;
import com.example.servicedesk.exception.InvalidEventException;
import com.example.servicedesk.filter.FilterDecision;
import com.example.servicedesk.support.EngineIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NotificationIngestionServiceTest extends EngineIntegrationTest {

    @Autowired
    private NotificationIngestionService ingestionService;

    @Autowired
    private NotificationConfigService configService;

    private FilterRule filterRule(String name, int priority, FilterAction action, Map<String, Object> params,
                                  FilterCondition... conditions) {
        return configService.createFilterRule(FilterRule.builder()
                .name(name)
                .priority(priority)
                .action(action)
                .actionParams(new LinkedHashMap<>(params))
                .conditions(new ArrayList<>(List.of(conditions)))
                .build(), "admin");
    }

    private void slaBreachRule() {
        configService.createEscalationRule(EscalationRule.builder()
                .name("SLA breach")
                .conditions(new ArrayList<>(List.of(
                        new EscalationCondition("event_type", new LinkedHashMap<>(Map.of("types", List.of("sla_breach")))),
                        new EscalationCondition("time_based", new LinkedHashMap<>(Map.of("timeoutMinutes", 2))))))
                .actions(new ArrayList<>(List.of(
                        new EscalationAction("raise_priority", new LinkedHashMap<>()))))
                .maxEscalations(2)
                .cooldownPeriodMinutes(15)
                .build(), "admin");
    }

    @Test
    void blockedEventNeverReachesABatch() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");
        filterRule("Block spam", 1, FilterAction.BLOCK, Map.of(), new FilterCondition("content", "contains", "spam"));
        NotificationEvent spam = event("comment_added", "T-1", "alice");
        spam.getPayload().put("message", "Buy cheap SPAM now");

        FilterDecision decision = ingestionService.ingest(spam);

        assertTrue(decision.isBlocked());
        assertTrue(batchRepository.findAll().isEmpty());
        assertEquals(0, deferredQueue.size());
        assertTrue(sink.getDelivered().isEmpty());
    }

    @Test
    void allowedEventIsBatched() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");

        FilterDecision decision = ingestionService.ingest(event("comment_added", "T-1", "alice"));

        assertEquals(FilterAction.ALLOW, decision.getAction());
        List<NotificationBatch> pending = batchRepository.findAll();
        assertEquals(1, pending.size());
        assertEquals(BatchStatus.PENDING, pending.get(0).getStatus());
    }

    @Test
    void delayedEventWaitsOutsideBatches() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");
        filterRule("Hold low priority", 1, FilterAction.DELAY, Map.of("delayMinutes", 30),
                new FilterCondition("priority", "equals", "low"));
        NotificationEvent low = event("comment_added", "T-1", "alice");
        low.setPriority(NotificationPriority.LOW);

        FilterDecision decision = ingestionService.ingest(low);

        assertEquals(clock.instant().plus(Duration.ofMinutes(30)), decision.getDelayUntil());
        assertEquals(1, deferredQueue.size());
        assertTrue(batchRepository.findAll().isEmpty());
    }

    @Test
    void priorityRaisedToCriticalBypassesBatching() {
        saveBatchConfig("sla_warnings", 20, 120_000, GroupingStrategy.PRIORITY, "sla_warning");
        filterRule("Escalate warnings", 1, FilterAction.PRIORITY_CHANGE, Map.of("newPriority", "critical"),
                new FilterCondition("type", "equals", "sla_warning"));

        ingestionService.ingest(event("sla_warning", "T-1", "alice"));

        assertEquals(1, sink.getDelivered().size());
        NotificationEvent delivered = sink.getDelivered().get(0).getNotifications().get(0);
        assertEquals(NotificationPriority.CRITICAL, delivered.getPriority());
    }

    @Test
    void missingFieldsAreFilledIn() {
        saveBatchConfig("digest_email", 50, 900_000, GroupingStrategy.USER);
        NotificationEvent bare = NotificationEvent.builder().type("ticket_merged").build();

        FilterDecision decision = ingestionService.ingest(bare);

        NotificationEvent normalized = decision.getEvent();
        assertNotNull(normalized.getId());
        assertEquals(clock.instant(), normalized.getOccurredAt());
        assertEquals(NotificationPriority.MEDIUM, normalized.getPriority());
        assertEquals("user_all", batchRepository.findAll().get(0).getGroupKey());
    }

    @Test
    void eventWithoutTypeIsRejected() {
        assertThrows(InvalidEventException.class,
                () -> ingestionService.ingest(NotificationEvent.builder().ticketId("T-1").build()));
    }

    @Test
    void matchingEventStartsEscalation() {
        slaBreachRule();

        ingestionService.ingest(event("sla_breach", "T-9", "alice"));

        assertEquals(1, escalationInstanceRepository.findBySubjectIdOrderByTriggeredAtDesc("T-9").size());
    }

    @Test
    void blockedEventStartsNoEscalation() {
        slaBreachRule();
        filterRule("Mute breaches", 1, FilterAction.BLOCK, Map.of(), new FilterCondition("type", "equals", "sla_breach"));

        ingestionService.ingest(event("sla_breach", "T-9", "alice"));

        assertTrue(escalationInstanceRepository.findBySubjectIdOrderByTriggeredAtDesc("T-9").isEmpty());
    }

    @Test
    void previewDoesNotBatch() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");

        FilterDecision decision = ingestionService.preview(event("comment_added", "T-1", "alice"));

        assertEquals(FilterAction.ALLOW, decision.getAction());
        assertTrue(batchRepository.findAll().isEmpty());
    }

    @Test
    void recipientPreferencesNarrowTargetsBeforeTheRules() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");
        preferencesRepository.save(UserNotificationPreferences.builder()
                .userId("alice")
                .disabledCategories(new LinkedHashSet<>(Set.of("comments")))
                .build());

        FilterDecision decision = ingestionService.ingest(event("comment_added", "T-1", "alice", "bob"));

        assertEquals(FilterAction.ALLOW, decision.getAction());
        NotificationEvent batched = batchRepository.findAll().get(0).getNotifications().get(0);
        assertEquals(List.of("bob"), batched.getTargetUserIds());
    }

    @Test
    void eventNoRecipientAcceptsIsBlockedBeforeTheRules() {
        slaBreachRule();
        filterRule("Allow breaches", 1, FilterAction.ALLOW, Map.of(), new FilterCondition("type", "equals", "sla_breach"));
        preferencesRepository.save(UserNotificationPreferences.builder()
                .userId("alice")
                .disabledCategories(new LinkedHashSet<>(Set.of("sla_warnings")))
                .build());

        FilterDecision decision = ingestionService.ingest(event("sla_breach", "T-9", "alice"));

        assertTrue(decision.isBlocked());
        assertNull(decision.getRuleId());
        assertNotNull(decision.getReason());
        assertFalse(decision.isDefault());
        assertTrue(batchRepository.findAll().isEmpty());
        assertTrue(escalationInstanceRepository.findBySubjectIdOrderByTriggeredAtDesc("T-9").isEmpty());
    }

    @Test
    void hourlyLimitCountsForwardedNotifications() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");
        preferencesRepository.save(UserNotificationPreferences.builder().userId("alice").maxPerHour(2).build());

        assertFalse(ingestionService.ingest(event("comment_added", "T-1", "alice")).isBlocked());
        assertFalse(ingestionService.ingest(event("comment_added", "T-2", "alice")).isBlocked());
        assertTrue(ingestionService.ingest(event("comment_added", "T-3", "alice")).isBlocked());

        clock.advance(Duration.ofMinutes(61));
        assertFalse(ingestionService.ingest(event("comment_added", "T-4", "alice")).isBlocked());
    }

    @Test
    void previewDoesNotCountTowardsLimits() {
        saveBatchConfig("comment_notifications", 10, 60_000, GroupingStrategy.TICKET, "comment_added");
        preferencesRepository.save(UserNotificationPreferences.builder().userId("alice").maxPerHour(1).build());

        assertEquals(FilterAction.ALLOW, ingestionService.preview(event("comment_added", "T-1", "alice")).getAction());
        assertEquals(FilterAction.ALLOW, ingestionService.preview(event("comment_added", "T-1", "alice")).getAction());
        ingestionService.ingest(event("comment_added", "T-1", "alice"));

        assertTrue(ingestionService.preview(event("comment_added", "T-1", "alice")).isBlocked());
    }
}
