package com.example.servicedesk.controller;

import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.service.TicketStateService;
import com.example.servicedesk.subject.TicketState;
import com.example.servicedesk.subject.TicketStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Ticket state reports from the ticketing side.
 */
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketStateController {

    private final TicketStateService ticketStateService;

    @PostMapping("/{ticketId}/state")
    public ResponseEntity<TicketState> updateState(@PathVariable String ticketId, @RequestBody TicketStateUpdate update) {
        return ResponseEntity.ok(ticketStateService.updateState(
                ticketId, update.status(), update.assigneeId(), update.priority()));
    }

    @GetMapping("/{ticketId}/state")
    public ResponseEntity<TicketState> getState(@PathVariable String ticketId) {
        return ResponseEntity.ok(ticketStateService.getState(ticketId));
    }

    public record TicketStateUpdate(TicketStatus status, String assigneeId, NotificationPriority priority) {
    }
}
