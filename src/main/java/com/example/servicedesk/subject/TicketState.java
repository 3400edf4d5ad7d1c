package com.example.servicedesk.subject;

import com.example.servicedesk.domain.NotificationPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TicketState {
    private String ticketId;
    private TicketStatus status;
    private String assigneeId;
    private NotificationPriority priority;
    private Instant updatedAt;
}
