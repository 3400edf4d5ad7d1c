package com.example.servicedesk.service;

import com.example.servicedesk.domain.AuditLog;
import com.example.servicedesk.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Audit trail for filter decisions, batch flushes, delivery outcomes and escalation transitions.
 * Writes are async so the submission path never waits on them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Async("auditExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details) {
        log(actor, action, target, details, true);
    }

    @Async("auditExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details, boolean success) {
        try {
            String detailsJson = details != null ? objectMapper.writeValueAsString(details) : null;
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(target)
                    .details(detailsJson)
                    .success(success)
                    .timestamp(clock.instant())
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} ({})", actor, action, target, success ? "OK" : "FAIL");
        } catch (Exception e) {
            log.error("Failed to write audit log: {}", e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, limit)).getContent();
    }

    public List<AuditLog> getForTarget(String target) {
        return auditLogRepository.findByTargetOrderByTimestampDesc(target);
    }

    public List<AuditLog> getByAction(String action) {
        return auditLogRepository.findByActionOrderByTimestampDesc(action);
    }

    public long countByAction(String action) {
        return auditLogRepository.countByAction(action);
    }
}
