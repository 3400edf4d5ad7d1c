package com.example.servicedesk.service;

import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.escalation.EscalationManager;
import com.example.servicedesk.subject.TicketState;
import com.example.servicedesk.subject.TicketStateRegistry;
import com.example.servicedesk.subject.TicketStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Applies ticket state reports from the ticketing side. Closing or deleting a ticket
 * cancels its active escalations right away; acknowledging or resolving it lets them
 * complete on their next cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketStateService {

    private final TicketStateRegistry ticketStateRegistry;
    private final EscalationManager escalationManager;
    private final AuditService auditService;

    public TicketState updateState(String ticketId, TicketStatus status, String assigneeId, NotificationPriority priority) {
        ticketStateRegistry.update(ticketId, status, assigneeId, priority);
        TicketState state = ticketStateRegistry.get(ticketId).orElseThrow();
        log.debug("Ticket {} is now {}", ticketId, state.getStatus());

        if (!state.getStatus().isOpen()) {
            int cancelled = escalationManager.cancelForSubject(ticketId, "Ticket " + state.getStatus().wireName());
            if (cancelled > 0) {
                log.info("Ticket {} {}: cancelled {} escalation(s)", ticketId, state.getStatus().wireName(), cancelled);
                auditService.log("ticketing", "TICKET_CLOSED", ticketId, Map.of("cancelled_escalations", cancelled));
            }
        }
        return state;
    }

    public TicketState getState(String ticketId) {
        return ticketStateRegistry.get(ticketId)
                .orElseGet(() -> TicketState.builder().ticketId(ticketId).status(TicketStatus.OPEN).build());
    }
}
