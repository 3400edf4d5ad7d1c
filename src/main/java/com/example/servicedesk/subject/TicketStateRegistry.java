package com.example.servicedesk.subject;

import com.example.servicedesk.domain.NotificationPriority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known state of each ticket, as reported by the ticketing side.
 * A ticket never reported is treated as open and unresolved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketStateRegistry implements SubjectGateway {

    private final Map<String, TicketState> tickets = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Merges a reported state; null fields keep their previous value.
     *
     * @return the state before the update, if the ticket was known
     */
    public Optional<TicketState> update(String ticketId, TicketStatus status, String assigneeId,
                                        NotificationPriority priority) {
        TicketState[] previous = new TicketState[1];
        tickets.compute(ticketId, (id, current) -> {
            previous[0] = current;
            TicketState base = current != null ? current
                    : TicketState.builder().ticketId(id).status(TicketStatus.OPEN).build();
            return base.toBuilder()
                    .status(status != null ? status : base.getStatus())
                    .assigneeId(assigneeId != null ? assigneeId : base.getAssigneeId())
                    .priority(priority != null ? priority : base.getPriority())
                    .updatedAt(clock.instant())
                    .build();
        });
        return Optional.ofNullable(previous[0]);
    }

    public Optional<TicketState> get(String ticketId) {
        return Optional.ofNullable(tickets.get(ticketId));
    }

    public void forget(String ticketId) {
        tickets.remove(ticketId);
    }

    public void clear() {
        tickets.clear();
    }

    @Override
    public boolean isSubjectOpen(String subjectId) {
        return get(subjectId).map(t -> t.getStatus().isOpen()).orElse(true);
    }

    @Override
    public boolean isSubjectResolved(String subjectId) {
        return get(subjectId).map(t -> t.getStatus().isResolved()).orElse(false);
    }

    @Override
    public Optional<String> getAssignee(String subjectId) {
        return get(subjectId).map(TicketState::getAssigneeId);
    }

    @Override
    public Optional<String> reassign(String subjectId, String assigneeId) {
        Optional<String> previous = update(subjectId, null, assigneeId, null).map(TicketState::getAssigneeId);
        log.info("Ticket {} reassigned to {} (was {})", subjectId, assigneeId, previous.orElse("unassigned"));
        return previous;
    }

    @Override
    public Optional<NotificationPriority> changePriority(String subjectId, NotificationPriority priority) {
        Optional<NotificationPriority> previous = update(subjectId, null, null, priority).map(TicketState::getPriority);
        log.info("Ticket {} priority set to {} (was {})", subjectId, priority, previous.orElse(null));
        return previous;
    }

    @Override
    public Optional<NotificationPriority> getPriority(String subjectId) {
        return get(subjectId).map(TicketState::getPriority);
    }
}
