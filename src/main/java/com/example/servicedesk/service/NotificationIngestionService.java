package com.example.servicedesk.service;

import com.example.servicedesk.batching.BatchingEngine;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.escalation.EscalationAlertPublisher;
import com.example.servicedesk.escalation.EscalationManager;
import com.example.servicedesk.exception.InvalidEventException;
import com.example.servicedesk.filter.FilterDecision;
import com.example.servicedesk.filter.FilterEngine;
import com.example.servicedesk.filter.RecipientFilterResult;
import com.example.servicedesk.filter.RecipientFrequencyTracker;
import com.example.servicedesk.filter.RecipientPreferenceFilter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for ticket events: recipient preferences, then filter rules, then batching,
 * then escalation matching.
 *
 * Blocked events stop here and never reach a batch. Escalation alerts go through the
 * same path but do not start escalations themselves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationIngestionService {

    private final RecipientPreferenceFilter preferenceFilter;
    private final RecipientFrequencyTracker frequencyTracker;
    private final FilterEngine filterEngine;
    private final BatchingEngine batchingEngine;
    private final EscalationManager escalationManager;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public FilterDecision ingest(NotificationEvent event) {
        NotificationEvent normalized = normalize(event);
        RecipientFilterResult recipients = preferenceFilter.apply(normalized, clock.instant());
        if (recipients.isBlocked()) {
            FilterDecision decision = FilterDecision.blockedForAllRecipients(normalized);
            meterRegistry.counter("servicedesk.filter.decisions", "action", decision.getAction().wireName()).increment();
            log.info("Event {} ({}) dropped by the preferences of all {} target users",
                    normalized.getId(), normalized.getType(), recipients.getDroppedRecipients().size());
            auditService.log("filter-engine", "NOTIFICATION_BLOCKED", normalized.getId(), Map.of(
                    "type", normalized.getType(),
                    "reason", decision.getReason(),
                    "recipients", recipients.getDroppedRecipients()));
            return decision;
        }

        FilterDecision decision = filterEngine.evaluate(recipients.getEvent());
        meterRegistry.counter("servicedesk.filter.decisions", "action", decision.getAction().wireName()).increment();

        if (decision.isBlocked()) {
            log.info("Event {} ({}) blocked by filter rule '{}'",
                    normalized.getId(), normalized.getType(), decision.getRuleName());
            auditService.log("filter-engine", "NOTIFICATION_BLOCKED", normalized.getId(), Map.of(
                    "type", normalized.getType(),
                    "rule_id", decision.getRuleId(),
                    "rule_name", String.valueOf(decision.getRuleName())));
            return decision;
        }

        NotificationEvent forwarded = decision.getEvent();
        batchingEngine.submit(forwarded, decision.getDelayUntil());
        frequencyTracker.record(forwarded.getTargetUserIds(), clock.instant());

        if (forwarded.getTicketId() != null
                && !EscalationAlertPublisher.ESCALATION_ALERT_TYPE.equals(forwarded.getType())) {
            escalationManager.evaluateEvent(forwarded);
        }
        return decision;
    }

    /**
     * The decision the event would get now, without batching or escalating it.
     */
    public FilterDecision preview(NotificationEvent event) {
        NotificationEvent normalized = normalize(event);
        RecipientFilterResult recipients = preferenceFilter.apply(normalized, clock.instant());
        if (recipients.isBlocked()) {
            return FilterDecision.blockedForAllRecipients(normalized);
        }
        return filterEngine.evaluate(recipients.getEvent());
    }

    NotificationEvent normalize(NotificationEvent event) {
        if (event == null || event.getType() == null || event.getType().isBlank()) {
            throw new InvalidEventException("Event type is required");
        }
        return event.toBuilder()
                .id(event.getId() != null ? event.getId() : UUID.randomUUID().toString())
                .occurredAt(event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant())
                .priority(event.getPriority() != null ? event.getPriority() : NotificationPriority.MEDIUM)
                .targetUserIds(event.getTargetUserIds() != null ? new ArrayList<>(event.getTargetUserIds()) : new ArrayList<>())
                .payload(event.getPayload() != null ? new LinkedHashMap<>(event.getPayload()) : new LinkedHashMap<>())
                .build();
    }
}
