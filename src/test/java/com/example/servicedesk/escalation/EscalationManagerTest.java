package com.example.servicedesk.escalation;

import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.EscalationCondition;
import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.EscalationStatus;
import com.example.servicedesk.domain.ExecutedAction;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.exception.EntityNotFoundException;
import com.example.servicedesk.exception.InvalidConfigurationException;
import com.example.servicedesk.service.TicketStateService;
import com.example.servicedesk.subject.TicketStatus;
import com.example.servicedesk.support.EngineIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EscalationManagerTest extends EngineIntegrationTest {

    private static final String TICKET = "T-500";

    @Autowired
    private EscalationManager escalationManager;

    @Autowired
    private TicketStateService ticketStateService;

    @BeforeEach
    void openTicket() {
        ticketStateRegistry.update(TICKET, TicketStatus.OPEN, "agent-1", NotificationPriority.HIGH);
    }

    private EscalationRule saveRule(int maxEscalations, int cooldownMinutes, List<EscalationCondition> conditions,
                                    EscalationAction... actions) {
        return escalationRuleRepository.save(EscalationRule.builder()
                .name("Unattended ticket")
                .conditions(new ArrayList<>(conditions))
                .actions(new ArrayList<>(List.of(actions)))
                .maxEscalations(maxEscalations)
                .cooldownPeriodMinutes(cooldownMinutes)
                .priority(10)
                .active(true)
                .createdBy("admin")
                .createdAt(clock.instant())
                .build());
    }

    private static EscalationCondition condition(String type, Map<String, Object> parameters) {
        return new EscalationCondition(type, new LinkedHashMap<>(parameters));
    }

    private static EscalationAction action(String type, Map<String, Object> parameters) {
        return new EscalationAction(type, new LinkedHashMap<>(parameters));
    }

    private static List<EscalationCondition> afterMinutes(int minutes) {
        return List.of(condition("time_based", Map.of("timeoutMinutes", minutes)));
    }

    private EscalationInstance reload(EscalationInstance instance) {
        return escalationManager.getInstance(instance.getId());
    }

    @Test
    void instanceRunsEachLevelOnceAndCompletesAtMaxEscalations() {
        EscalationRule rule = saveRule(2, 10, afterMinutes(5),
                action("notify_role", Map.of("role", "manager")),
                action("raise_priority", Map.of()));

        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);
        assertEquals(EscalationStatus.PENDING, instance.getStatus());
        assertEquals(1, instance.getEscalationLevel());
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), instance.getNextActionAt());

        assertTrue(escalationManager.tick().isEmpty());

        clock.advance(Duration.ofMinutes(5));
        escalationManager.tick();
        EscalationInstance afterFirst = reload(instance);
        assertEquals(EscalationStatus.PENDING, afterFirst.getStatus());
        assertEquals(2, afterFirst.getEscalationLevel());
        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), afterFirst.getNextActionAt());
        assertEquals(2, afterFirst.getExecutedActions().size());

        clock.advance(Duration.ofMinutes(10));
        escalationManager.tick();
        EscalationInstance completed = reload(instance);
        assertEquals(EscalationStatus.COMPLETED, completed.getStatus());
        assertNull(completed.getNextActionAt());
        assertEquals(List.of(1, 1, 2, 2), completed.getExecutedActions().stream()
                .map(ExecutedAction::getEscalationLevel).toList());

        clock.advance(Duration.ofHours(2));
        assertTrue(escalationManager.tick().isEmpty());
        assertEquals(4, reload(instance).getExecutedActions().size());
    }

    @Test
    void notifyStepsEmitEscalationAlertsToRoleMembers() {
        EscalationRule rule = saveRule(1, 10, afterMinutes(0), action("notify_role", Map.of("role", "manager")));

        escalationManager.trigger(rule.getId(), TICKET);
        escalationManager.tick();

        assertEquals(1, sink.getDelivered().size());
        NotificationEvent alert = sink.getDelivered().get(0).getNotifications().get(0);
        assertEquals(EscalationAlertPublisher.ESCALATION_ALERT_TYPE, alert.getType());
        assertEquals(List.of("manager-1", "manager-2"), alert.getTargetUserIds());
        assertEquals(TICKET, alert.getTicketId());
        assertEquals(1, ((Number) alert.getPayload().get("escalationLevel")).intValue());
    }

    @Test
    void reassignAndRaisePriorityChangeTheTicket() {
        EscalationRule rule = saveRule(1, 10, afterMinutes(0),
                action("reassign", Map.of("assignee", "senior-agent")),
                action("raise_priority", Map.of()));

        escalationManager.trigger(rule.getId(), TICKET);
        escalationManager.tick();

        assertEquals("senior-agent", ticketStateRegistry.getAssignee(TICKET).orElseThrow());
        assertEquals(NotificationPriority.CRITICAL, ticketStateRegistry.getPriority(TICKET).orElseThrow());
    }

    @Test
    void resolvedSubjectCompletesWithoutRunningFurtherSteps() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(0), action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);
        escalationManager.tick();
        assertEquals(1, reload(instance).getExecutedActions().size());

        ticketStateRegistry.update(TICKET, TicketStatus.RESOLVED, null, null);
        clock.advance(Duration.ofMinutes(10));
        escalationManager.tick();

        EscalationInstance completed = reload(instance);
        assertEquals(EscalationStatus.COMPLETED, completed.getStatus());
        assertEquals("Subject resolved", completed.getStatusReason());
        assertEquals(1, completed.getExecutedActions().size());
    }

    @Test
    void cancelEndsAnActiveInstanceAndIsANoOpOnceTerminal() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(5), action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);

        assertTrue(escalationManager.cancel(instance.getId(), "Handled by phone"));
        assertFalse(escalationManager.cancel(instance.getId(), "again"));

        EscalationInstance cancelled = reload(instance);
        assertEquals(EscalationStatus.CANCELLED, cancelled.getStatus());
        assertEquals("Handled by phone", cancelled.getStatusReason());
        assertNull(cancelled.getNextActionAt());

        clock.advance(Duration.ofHours(1));
        assertTrue(escalationManager.tick().isEmpty());
        assertTrue(reload(instance).getExecutedActions().isEmpty());
    }

    @Test
    void cancellingUnknownInstanceFails() {
        assertThrows(EntityNotFoundException.class, () -> escalationManager.cancel("missing", null));
    }

    @Test
    void triggerIsIdempotentWhileAnInstanceIsActive() {
        EscalationRule rule = saveRule(1, 10, afterMinutes(5), action("raise_priority", Map.of()));

        EscalationInstance first = escalationManager.trigger(rule.getId(), TICKET);
        EscalationInstance second = escalationManager.trigger(rule.getId(), TICKET);
        assertEquals(first.getId(), second.getId());
        assertEquals(1, escalationInstanceRepository.count());

        escalationManager.cancel(first.getId(), "done");
        EscalationInstance third = escalationManager.trigger(rule.getId(), TICKET);
        assertNotEquals(first.getId(), third.getId());
    }

    @Test
    void triggeringAnInactiveRuleIsRejected() {
        EscalationRule rule = saveRule(1, 10, afterMinutes(5), action("raise_priority", Map.of()));
        rule.setActive(false);
        escalationRuleRepository.save(rule);

        assertThrows(InvalidConfigurationException.class, () -> escalationManager.trigger(rule.getId(), TICKET));
        assertThrows(EntityNotFoundException.class, () -> escalationManager.trigger("no-such-rule", TICKET));
    }

    @Test
    void everyStepFailingMarksTheInstanceFailed() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(0),
                action("reassign", Map.of()),
                action("webhook", Map.of("url", "http://localhost:1/escalations")));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);

        escalationManager.tick();

        EscalationInstance failed = reload(instance);
        assertEquals(EscalationStatus.FAILED, failed.getStatus());
        assertEquals(2, failed.getExecutedActions().size());
        assertTrue(failed.getExecutedActions().stream().noneMatch(ExecutedAction::isSuccess));
        assertTrue(failed.getExecutedActions().stream().allMatch(step -> step.getRetryCount() == 1));
        assertEquals("reassign requires assignee", failed.getExecutedActions().get(0).getError());
    }

    @Test
    void partialFailureIsRecordedAndEscalationContinues() {
        EscalationRule rule = saveRule(2, 10, afterMinutes(0),
                action("reassign", Map.of()),
                action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);

        escalationManager.tick();

        EscalationInstance advanced = reload(instance);
        assertEquals(EscalationStatus.PENDING, advanced.getStatus());
        assertEquals(2, advanced.getEscalationLevel());
        assertFalse(advanced.getExecutedActions().get(0).isSuccess());
        assertTrue(advanced.getExecutedActions().get(1).isSuccess());
    }

    @Test
    void closingTheTicketCancelsItsEscalations() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(5), action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);

        ticketStateService.updateState(TICKET, TicketStatus.CLOSED, null, null);

        assertEquals(EscalationStatus.CANCELLED, reload(instance).getStatus());
        assertTrue(escalationManager.getActiveInstances().isEmpty());
    }

    @Test
    void closedSubjectIsCancelledOnItsNextCycle() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(0), action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);
        ticketStateRegistry.update(TICKET, TicketStatus.DELETED, null, null);

        escalationManager.tick();

        EscalationInstance cancelled = reload(instance);
        assertEquals(EscalationStatus.CANCELLED, cancelled.getStatus());
        assertEquals("Subject closed", cancelled.getStatusReason());
        assertTrue(cancelled.getExecutedActions().isEmpty());
    }

    @Test
    void deletedRuleCancelsItsInstances() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(0), action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);
        escalationRuleRepository.deleteById(rule.getId());

        escalationManager.tick();

        assertEquals(EscalationStatus.CANCELLED, reload(instance).getStatus());
    }

    @Test
    void matchingEventsStartEscalationsAutomatically() {
        saveRule(1, 10, List.of(
                condition("min_priority", Map.of("priority", "high")),
                condition("time_based", Map.of("timeoutMinutes", 15))),
                action("raise_priority", Map.of()));
        saveRule(1, 10, afterMinutes(1), action("raise_priority", Map.of()));

        NotificationEvent low = event("ticket_updated", TICKET, "alice");
        low.setPriority(NotificationPriority.LOW);
        assertTrue(escalationManager.evaluateEvent(low).isEmpty());

        NotificationEvent high = event("ticket_updated", TICKET, "alice");
        high.setPriority(NotificationPriority.CRITICAL);
        List<EscalationInstance> started = escalationManager.evaluateEvent(high);

        assertEquals(1, started.size());
        assertEquals(high.getId(), started.get(0).getNotificationId());
        assertEquals(clock.instant().plus(Duration.ofMinutes(15)), started.get(0).getNextActionAt());
    }

    @Test
    void interruptedCycleIsRescheduledOnStartup() {
        EscalationRule rule = saveRule(1, 10, afterMinutes(0), action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);
        EscalationInstance stuck = reload(instance);
        stuck.setStatus(EscalationStatus.EXECUTING);
        escalationInstanceRepository.save(stuck);

        escalationManager.recoverInterruptedCycles();

        assertEquals(EscalationStatus.PENDING, reload(instance).getStatus());
        escalationManager.tick();
        assertEquals(EscalationStatus.COMPLETED, reload(instance).getStatus());
    }

    @Test
    void cancelDuringACycleWinsOverTheCycleCommit() {
        EscalationRule rule = saveRule(3, 10, afterMinutes(0),
                action("notify_user", Map.of("userId", "lead-1")),
                action("raise_priority", Map.of()));
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);
        // The alert of the first step is delivered while the cycle is still running
        sink.onDeliver(batch -> escalationManager.cancel(instance.getId(), "Ticket merged"));

        escalationManager.tick();

        EscalationInstance cancelled = reload(instance);
        assertEquals(EscalationStatus.CANCELLED, cancelled.getStatus());
        assertEquals("Ticket merged", cancelled.getStatusReason());
        assertEquals(1, cancelled.getEscalationLevel());
        assertNull(cancelled.getNextActionAt());
        assertEquals(List.of("notify_user", "raise_priority"), cancelled.getExecutedActions().stream()
                .map(ExecutedAction::getActionType).toList());
        assertTrue(cancelled.getExecutedActions().stream().allMatch(ExecutedAction::isSuccess));
        assertEquals(1, sink.getDelivered().size());

        sink.onDeliver(batch -> { });
        clock.advance(Duration.ofHours(1));
        assertTrue(escalationManager.tick().isEmpty());
        assertEquals(EscalationStatus.CANCELLED, reload(instance).getStatus());
    }
}
