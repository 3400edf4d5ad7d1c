package com.example.servicedesk.escalation;

import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.EscalationCondition;
import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.EscalationStatus;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.subject.TicketStateRegistry;
import com.example.servicedesk.subject.TicketStatus;
import com.example.servicedesk.support.EngineIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doReturn;

/**
 * A cycle that breaks after its instance went EXECUTING must not leave it there.
 */
class EscalationCycleFailureTest extends EngineIntegrationTest {

    private static final String TICKET = "T-900";

    @SpyBean
    private TicketStateRegistry subjectStates;

    @Autowired
    private EscalationManager escalationManager;

    @Test
    void unexpectedErrorAfterStepsRanFailsTheInstance() {
        subjectStates.update(TICKET, TicketStatus.OPEN, "agent-1", NotificationPriority.HIGH);
        EscalationRule rule = escalationRuleRepository.save(EscalationRule.builder()
                .name("Unassigned too long")
                .conditions(new ArrayList<>(List.of(new EscalationCondition("time_based",
                        new LinkedHashMap<>(Map.of("timeoutMinutes", 5))))))
                .actions(new ArrayList<>(List.of(new EscalationAction("reassign",
                        new LinkedHashMap<>(Map.of("assignee", "agent-2"))))))
                .maxEscalations(3)
                .cooldownPeriodMinutes(10)
                .priority(10)
                .active(true)
                .createdBy("admin")
                .createdAt(clock.instant())
                .build());
        EscalationInstance instance = escalationManager.trigger(rule.getId(), TICKET);

        // resolved check before the cycle passes, the one after the steps blows up
        doReturn(false)
                .doThrow(new IllegalStateException("ticket store unavailable"))
                .when(subjectStates).isSubjectResolved(TICKET);

        clock.advance(Duration.ofMinutes(5));
        List<EscalationInstance> advanced = assertDoesNotThrow(() -> escalationManager.tick());

        EscalationInstance failed = escalationManager.getInstance(instance.getId());
        assertEquals(EscalationStatus.FAILED, failed.getStatus());
        assertTrue(failed.getStatusReason().contains("ticket store unavailable"));
        assertNull(failed.getNextActionAt());
        assertEquals(1, failed.getEscalationLevel());
        assertEquals(1, advanced.size());
        assertEquals("agent-2", subjectStates.getAssignee(TICKET).orElseThrow());

        clock.advance(Duration.ofHours(1));
        assertTrue(escalationManager.tick().isEmpty());
        assertEquals(EscalationStatus.FAILED, escalationManager.getInstance(instance.getId()).getStatus());
    }
}
