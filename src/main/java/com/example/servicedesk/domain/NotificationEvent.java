package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A ticket event that may become a notification. Never persisted on its own:
 * it is dropped by a filter rule, merged into a batch, or seeds an escalation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationEvent {

    private String id;

    /** e.g. ticket_assigned, comment_added, sla_warning, escalation_alert */
    private String type;

    @Builder.Default
    private List<String> targetUserIds = new ArrayList<>();

    private String ticketId;

    private String authorId;

    private NotificationPriority priority;

    /** Free-form content; title and message live here. */
    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    private Instant occurredAt;

    /** Explicit batch key, overrides routing by event type. */
    private String batchKey;

    /** false keeps the event out of accumulation; it is delivered on its own. */
    @Builder.Default
    private boolean batchable = true;

    public String getTitle() {
        Object title = payload != null ? payload.get("title") : null;
        return title != null ? title.toString() : null;
    }

    public String getMessage() {
        Object message = payload != null ? payload.get("message") : null;
        return message != null ? message.toString() : null;
    }
}
