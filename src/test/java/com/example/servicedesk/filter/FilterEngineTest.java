package com.example.servicedesk.filter;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.FilterAction;
import com.example.servicedesk.domain.FilterCondition;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.repository.FilterRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FilterEngineTest {

    private static final Instant OCCURRED = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private FilterRuleRepository filterRuleRepository;

    private final NotificationEngineProperties properties = new NotificationEngineProperties();

    private FilterEngine filterEngine;

    @BeforeEach
    void setUp() {
        filterEngine = new FilterEngine(filterRuleRepository, new ConditionEvaluator(), properties);
    }

    private static NotificationEvent event(String type, NotificationPriority priority, String... targets) {
        return NotificationEvent.builder()
                .id("evt-" + type)
                .type(type)
                .ticketId("T-1")
                .priority(priority)
                .targetUserIds(new ArrayList<>(List.of(targets)))
                .payload(new LinkedHashMap<>(Map.of("title", "Title", "message", "Body")))
                .occurredAt(OCCURRED)
                .build();
    }

    private static FilterRule rule(String id, int priority, FilterAction action, Map<String, Object> params,
                                   FilterCondition... conditions) {
        return FilterRule.builder()
                .id(id)
                .name("rule " + id)
                .priority(priority)
                .action(action)
                .actionParams(new LinkedHashMap<>(params))
                .conditions(new ArrayList<>(List.of(conditions)))
                .active(true)
                .build();
    }

    @Test
    void noMatchingRuleAllowsUnchanged() {
        NotificationEvent event = event("comment_added", NotificationPriority.LOW);

        FilterDecision decision = filterEngine.evaluate(event, List.of(
                rule("r1", 1, FilterAction.BLOCK, Map.of(), new FilterCondition("type", "equals", "sla_breach"))));

        assertEquals(FilterAction.ALLOW, decision.getAction());
        assertTrue(decision.isDefault());
        assertSame(event, decision.getEvent());
    }

    @Test
    void lowestPriorityValueWinsThenId() {
        NotificationEvent event = event("comment_added", NotificationPriority.LOW);
        FilterCondition always = new FilterCondition("type", "equals", "comment_added");

        FilterDecision decision = filterEngine.evaluate(event, List.of(
                rule("b", 5, FilterAction.BLOCK, Map.of(), always),
                rule("a", 5, FilterAction.ALLOW, Map.of(), always),
                rule("z", 9, FilterAction.BLOCK, Map.of(), always)));

        assertEquals("a", decision.getRuleId());
        assertEquals(FilterAction.ALLOW, decision.getAction());
    }

    @Test
    void blockMatchReturnsNoEvent() {
        when(filterRuleRepository.findByActiveTrueOrderByPriorityAscIdAsc()).thenReturn(List.of(
                rule("spam", 1, FilterAction.BLOCK, Map.of(), new FilterCondition("content", "contains", "body"))));

        FilterDecision decision = filterEngine.evaluate(event("comment_added", NotificationPriority.MEDIUM));

        assertTrue(decision.isBlocked());
        assertNull(decision.getEvent());
        assertEquals("spam", decision.getRuleId());
    }

    @Test
    void delayIsAnchoredOnEventTime() {
        FilterDecision decision = filterEngine.evaluate(event("comment_added", NotificationPriority.LOW), List.of(
                rule("d", 1, FilterAction.DELAY, Map.of("delayMinutes", 30),
                        new FilterCondition("priority", "equals", "low"))));

        assertEquals(FilterAction.DELAY, decision.getAction());
        assertEquals(OCCURRED.plus(Duration.ofMinutes(30)), decision.getDelayUntil());
        assertNotNull(decision.getEvent());
    }

    @Test
    void delayWithoutParametersUsesConfiguredDefault() {
        properties.getFilter().setDefaultDelayMinutes(7);

        FilterDecision decision = filterEngine.evaluate(event("comment_added", NotificationPriority.LOW), List.of(
                rule("d", 1, FilterAction.DELAY, Map.of())));

        assertEquals(OCCURRED.plus(Duration.ofMinutes(7)), decision.getDelayUntil());
    }

    @Test
    void modifyRewritesACopyAndLeavesTheOriginalAlone() {
        NotificationEvent original = event("ticket_updated", NotificationPriority.LOW, "alice");

        FilterDecision decision = filterEngine.evaluate(original, List.of(
                rule("m", 1, FilterAction.MODIFY, Map.of(
                        "newPriority", "high",
                        "payload", Map.of("channel", "email"),
                        "setBatchable", false,
                        "batchKey", "ticket_updates"))));

        NotificationEvent modified = decision.getModifiedEvent();
        assertNotNull(modified);
        assertEquals(NotificationPriority.HIGH, modified.getPriority());
        assertEquals("email", modified.getPayload().get("channel"));
        assertFalse(modified.isBatchable());
        assertEquals("ticket_updates", modified.getBatchKey());

        assertEquals(NotificationPriority.LOW, original.getPriority());
        assertFalse(original.getPayload().containsKey("channel"));
        assertTrue(original.isBatchable());
    }

    @Test
    void priorityChangeWithInvalidValueKeepsOriginalPriority() {
        FilterDecision decision = filterEngine.evaluate(event("sla_warning", NotificationPriority.MEDIUM), List.of(
                rule("p", 1, FilterAction.PRIORITY_CHANGE, Map.of("newPriority", "apocalyptic"))));

        assertEquals(FilterAction.PRIORITY_CHANGE, decision.getAction());
        assertEquals(NotificationPriority.MEDIUM, decision.getModifiedEvent().getPriority());
    }

    @Test
    void malformedRuleIsSkippedAndEvaluationContinues() {
        FilterDecision decision = filterEngine.evaluate(event("comment_added", NotificationPriority.MEDIUM), List.of(
                rule("broken", 1, FilterAction.BLOCK, Map.of(), new FilterCondition("nonsense", "equals", "x")),
                rule("next", 2, FilterAction.PRIORITY_CHANGE, Map.of("newPriority", "critical"))));

        assertEquals("next", decision.getRuleId());
        assertEquals(NotificationPriority.CRITICAL, decision.getEvent().getPriority());
    }

    @Test
    void inactiveAndForeignOwnerRulesAreIgnored() {
        FilterRule inactive = rule("inactive", 1, FilterAction.BLOCK, Map.of());
        inactive.setActive(false);
        FilterRule carolsRule = rule("carol", 2, FilterAction.BLOCK, Map.of());
        carolsRule.setOwnerUserId("carol");
        FilterRule alicesRule = rule("alice", 3, FilterAction.DELAY, Map.of("delayMs", 1000));
        alicesRule.setOwnerUserId("alice");

        FilterDecision decision = filterEngine.evaluate(event("comment_added", NotificationPriority.MEDIUM, "alice"),
                List.of(inactive, carolsRule, alicesRule));

        assertEquals("alice", decision.getRuleId());
        assertEquals(OCCURRED.plusMillis(1000), decision.getDelayUntil());
    }

    @Test
    void evaluationIsDeterministic() {
        NotificationEvent event = event("comment_added", NotificationPriority.LOW);
        List<FilterRule> rules = List.of(
                rule("d", 1, FilterAction.DELAY, Map.of("delayMinutes", 5), new FilterCondition("priority", "equals", "low")));

        FilterDecision first = filterEngine.evaluate(event, rules);
        FilterDecision second = filterEngine.evaluate(event, rules);

        assertEquals(first.getAction(), second.getAction());
        assertEquals(first.getDelayUntil(), second.getDelayUntil());
        assertEquals(first.getRuleId(), second.getRuleId());
    }

    @Test
    void delayBeyondTheRepresentableRangeSkipsTheRule() {
        NotificationEvent event = event("comment_added", NotificationPriority.LOW);
        List<FilterRule> rules = List.of(
                rule("r1", 1, FilterAction.DELAY, Map.of("delayMinutes", Long.MAX_VALUE)),
                rule("r2", 2, FilterAction.DELAY, Map.of("delayMs", Long.MAX_VALUE)),
                rule("r3", 3, FilterAction.BLOCK, Map.of()));

        FilterDecision decision = assertDoesNotThrow(() -> filterEngine.evaluate(event, rules));

        assertEquals(FilterAction.BLOCK, decision.getAction());
        assertEquals("r3", decision.getRuleId());
    }
}
