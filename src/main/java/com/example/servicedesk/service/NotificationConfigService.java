package com.example.servicedesk.service;

import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.exception.EntityNotFoundException;
import com.example.servicedesk.exception.InvalidConfigurationException;
import com.example.servicedesk.repository.BatchConfigurationRepository;
import com.example.servicedesk.repository.EscalationRuleRepository;
import com.example.servicedesk.repository.FilterRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Admin-owned configuration: filter rules, batch configurations and escalation rules.
 * Every change is validated first and audited after.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationConfigService {

    private final FilterRuleRepository filterRuleRepository;
    private final BatchConfigurationRepository batchConfigRepository;
    private final EscalationRuleRepository escalationRuleRepository;
    private final ConfigurationValidator validator;
    private final AuditService auditService;
    private final Clock clock;

    // Filter rules

    public List<FilterRule> listFilterRules(String ownerUserId) {
        List<FilterRule> rules = ownerUserId != null
                ? filterRuleRepository.findByOwnerUserId(ownerUserId)
                : filterRuleRepository.findAll();
        return rules.stream()
                .sorted(Comparator.comparingInt(FilterRule::getPriority).thenComparing(FilterRule::getId))
                .toList();
    }

    public FilterRule getFilterRule(String id) {
        return filterRuleRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("FilterRule", id));
    }

    public FilterRule createFilterRule(FilterRule rule, String actor) {
        validator.validate(rule);
        Instant now = clock.instant();
        rule.setId(null);
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        FilterRule saved = filterRuleRepository.save(rule);
        log.info("Filter rule '{}' created ({} at priority {})", saved.getName(), saved.getAction(), saved.getPriority());
        auditService.log(actor, "FILTER_RULE_CREATED", saved.getId(), Map.of("name", saved.getName()));
        return saved;
    }

    public FilterRule updateFilterRule(String id, FilterRule changes, String actor) {
        FilterRule existing = getFilterRule(id);
        validator.validate(changes);
        changes.setId(existing.getId());
        changes.setCreatedAt(existing.getCreatedAt());
        changes.setUpdatedAt(clock.instant());
        FilterRule saved = filterRuleRepository.save(changes);
        auditService.log(actor, "FILTER_RULE_UPDATED", id, Map.of("name", saved.getName()));
        return saved;
    }

    public void deleteFilterRule(String id, String actor) {
        FilterRule existing = getFilterRule(id);
        filterRuleRepository.delete(existing);
        log.info("Filter rule '{}' deleted", existing.getName());
        auditService.log(actor, "FILTER_RULE_DELETED", id, Map.of("name", existing.getName()));
    }

    // Batch configurations

    public List<BatchConfiguration> listBatchConfigurations() {
        return batchConfigRepository.findAll().stream()
                .sorted(Comparator.comparing(BatchConfiguration::getBatchKey))
                .toList();
    }

    public BatchConfiguration getBatchConfiguration(String batchKey) {
        return batchConfigRepository.findById(batchKey)
                .orElseThrow(() -> new EntityNotFoundException("BatchConfiguration", batchKey));
    }

    public BatchConfiguration createBatchConfiguration(BatchConfiguration config, String actor) {
        validator.validate(config);
        if (batchConfigRepository.existsById(config.getBatchKey())) {
            throw new InvalidConfigurationException("batchKey '" + config.getBatchKey() + "' already exists");
        }
        config.setUpdatedAt(clock.instant());
        BatchConfiguration saved = batchConfigRepository.save(config);
        log.info("Batch configuration '{}' created (max {} / {} ms, by {})",
                saved.getBatchKey(), saved.getMaxBatchSize(), saved.getMaxWaitTimeMs(), saved.getGroupBy());
        auditService.log(actor, "BATCH_CONFIG_CREATED", saved.getBatchKey(), Map.of());
        return saved;
    }

    /**
     * Applies to batches opened afterwards and to the size check of open ones.
     */
    public BatchConfiguration updateBatchConfiguration(String batchKey, BatchConfiguration changes, String actor) {
        getBatchConfiguration(batchKey);
        changes.setBatchKey(batchKey);
        validator.validate(changes);
        changes.setUpdatedAt(clock.instant());
        BatchConfiguration saved = batchConfigRepository.save(changes);
        auditService.log(actor, "BATCH_CONFIG_UPDATED", batchKey, Map.of(
                "max_batch_size", saved.getMaxBatchSize(),
                "max_wait_time_ms", saved.getMaxWaitTimeMs()));
        return saved;
    }

    public void deleteBatchConfiguration(String batchKey, String actor) {
        BatchConfiguration existing = getBatchConfiguration(batchKey);
        batchConfigRepository.delete(existing);
        auditService.log(actor, "BATCH_CONFIG_DELETED", batchKey, Map.of());
    }

    // Escalation rules

    public List<EscalationRule> listEscalationRules() {
        return escalationRuleRepository.findAll().stream()
                .sorted(Comparator.comparingInt(EscalationRule::getPriority).thenComparing(EscalationRule::getId))
                .toList();
    }

    public EscalationRule getEscalationRule(String id) {
        return escalationRuleRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("EscalationRule", id));
    }

    public EscalationRule createEscalationRule(EscalationRule rule, String actor) {
        validator.validate(rule);
        Instant now = clock.instant();
        rule.setId(null);
        rule.setCreatedBy(rule.getCreatedBy() != null ? rule.getCreatedBy() : actor);
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        EscalationRule saved = escalationRuleRepository.save(rule);
        log.info("Escalation rule '{}' created (max {} level(s), cooldown {} min)",
                saved.getName(), saved.getMaxEscalations(), saved.getCooldownPeriodMinutes());
        auditService.log(actor, "ESCALATION_RULE_CREATED", saved.getId(), Map.of("name", saved.getName()));
        return saved;
    }

    public EscalationRule updateEscalationRule(String id, EscalationRule changes, String actor) {
        EscalationRule existing = getEscalationRule(id);
        validator.validate(changes);
        changes.setId(existing.getId());
        changes.setCreatedBy(existing.getCreatedBy());
        changes.setCreatedAt(existing.getCreatedAt());
        changes.setUpdatedAt(clock.instant());
        EscalationRule saved = escalationRuleRepository.save(changes);
        auditService.log(actor, "ESCALATION_RULE_UPDATED", id, Map.of("name", saved.getName()));
        return saved;
    }

    /**
     * Active instances of a deleted rule are cancelled on their next cycle.
     */
    public void deleteEscalationRule(String id, String actor) {
        EscalationRule existing = getEscalationRule(id);
        escalationRuleRepository.delete(existing);
        log.info("Escalation rule '{}' deleted", existing.getName());
        auditService.log(actor, "ESCALATION_RULE_DELETED", id, Map.of("name", existing.getName()));
    }
}
