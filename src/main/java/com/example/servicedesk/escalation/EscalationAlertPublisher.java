package com.example.servicedesk.escalation;

import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.service.NotificationIngestionService;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Sends escalation alerts back through normal ingestion, so filter rules see them first.
 */
@Component
public class EscalationAlertPublisher {

    public static final String ESCALATION_ALERT_TYPE = "escalation_alert";

    private final NotificationIngestionService ingestionService;

    public EscalationAlertPublisher(@Lazy NotificationIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    public void publish(NotificationEvent event) {
        ingestionService.ingest(event);
    }
}
