package com.example.servicedesk.controller;

import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.filter.FilterDecision;
import com.example.servicedesk.service.NotificationIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ingestion endpoint for ticket events.
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationEventController {

    private final NotificationIngestionService ingestionService;

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> submitEvent(@RequestBody NotificationEvent event) {
        FilterDecision decision = ingestionService.ingest(event);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", decision.isBlocked() ? "blocked" : "accepted");
        body.put("decision", decision);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
