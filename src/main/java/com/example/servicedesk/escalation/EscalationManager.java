package com.example.servicedesk.escalation;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.EscalationStatus;
import com.example.servicedesk.domain.ExecutedAction;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.exception.EntityNotFoundException;
import com.example.servicedesk.exception.InvalidConfigurationException;
import com.example.servicedesk.locking.EntityLockRegistry;
import com.example.servicedesk.repository.EscalationInstanceRepository;
import com.example.servicedesk.repository.EscalationRuleRepository;
import com.example.servicedesk.service.AuditService;
import com.example.servicedesk.subject.SubjectGateway;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Escalation Manager - drives escalation instances through their levels.
 *
 * PENDING -> EXECUTING when nextActionAt passes. After the cycle's steps run:
 * FAILED if every step failed, COMPLETED if the subject got resolved or the last level ran,
 * otherwise back to PENDING one level up after the rule's cooldown. Closing the subject
 * or calling {@link #cancel} ends the instance as CANCELLED from any non-terminal state.
 *
 * One active instance exists per (rule, subject). Cycles of one instance are serialized
 * by its lock; cancellation is a single conditional update that a cycle in flight
 * re-checks before committing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationManager {

    private static final int MAX_REASON_LENGTH = 1000;

    private final EscalationRuleRepository ruleRepository;
    private final EscalationInstanceRepository instanceRepository;
    private final EscalationRuleMatcher ruleMatcher;
    private final EscalationActionRunner actionRunner;
    private final SubjectGateway subjectGateway;
    private final EntityLockRegistry lockRegistry;
    private final NotificationEngineProperties properties;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public EscalationInstance trigger(String ruleId, String subjectId) {
        return trigger(ruleId, subjectId, null);
    }

    /**
     * Starts escalating the subject under the rule. Returns the already active
     * instance, unchanged, if there is one.
     */
    public EscalationInstance trigger(String ruleId, String subjectId, String notificationId) {
        EscalationRule rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new EntityNotFoundException("EscalationRule", ruleId));
        if (!rule.isActive()) {
            throw new InvalidConfigurationException("Escalation rule " + ruleId + " is inactive");
        }

        return lockRegistry.withLock(EntityLockRegistry.escalationSubjectKey(ruleId, subjectId), () -> {
            Optional<EscalationInstance> active = instanceRepository
                    .findFirstByRuleIdAndSubjectIdAndStatusIn(ruleId, subjectId, EscalationStatus.ACTIVE);
            if (active.isPresent()) {
                log.debug("Escalation for rule '{}' on {} already active: {}", rule.getName(), subjectId, active.get().getId());
                return active.get();
            }

            Instant now = clock.instant();
            EscalationInstance instance = EscalationInstance.builder()
                    .id(UUID.randomUUID().toString())
                    .ruleId(ruleId)
                    .subjectId(subjectId)
                    .notificationId(notificationId != null ? notificationId : subjectId)
                    .escalationLevel(1)
                    .status(EscalationStatus.PENDING)
                    .triggeredAt(now)
                    .nextActionAt(ruleMatcher.firstActionAt(rule, now))
                    .updatedAt(now)
                    .build();
            instance = instanceRepository.save(instance);

            log.info("Escalation {} started: rule '{}' on {} (first cycle at {})",
                    instance.getId(), rule.getName(), subjectId, instance.getNextActionAt());
            recordTransition(instance, null, EscalationStatus.PENDING, "triggered");
            return instance;
        });
    }

    /**
     * Starts every active rule the event matches. Events without a ticket, or for a
     * ticket that is already closed, start nothing.
     */
    public List<EscalationInstance> evaluateEvent(NotificationEvent event) {
        if (event.getTicketId() == null || !subjectGateway.isSubjectOpen(event.getTicketId())) {
            return List.of();
        }
        List<EscalationInstance> started = new ArrayList<>();
        for (EscalationRule rule : ruleRepository.findByActiveTrueOrderByPriorityAscIdAsc()) {
            try {
                if (ruleMatcher.matches(rule, event)) {
                    started.add(trigger(rule.getId(), event.getTicketId(), event.getId()));
                }
            } catch (Exception e) {
                log.error("Failed to evaluate escalation rule '{}' for event {}: {}",
                        rule.getName(), event.getId(), e.getMessage(), e);
            }
        }
        return started;
    }

    public List<EscalationInstance> tick() {
        return tick(clock.instant());
    }

    /**
     * Runs one cycle for every PENDING instance due at {@code now}.
     * Failures are isolated per instance.
     */
    public List<EscalationInstance> tick(Instant now) {
        List<EscalationInstance> due = instanceRepository
                .findByStatusAndNextActionAtLessThanEqualOrderByNextActionAtAsc(EscalationStatus.PENDING, now);
        List<EscalationInstance> advanced = new ArrayList<>();
        for (EscalationInstance candidate : due) {
            try {
                lockRegistry.withLock(EntityLockRegistry.escalationInstanceKey(candidate.getId()),
                        () -> runCycle(candidate.getId(), now))
                        .ifPresent(advanced::add);
            } catch (Exception e) {
                log.error("Escalation cycle failed for instance {}: {}", candidate.getId(), e.getMessage(), e);
            }
        }
        if (!advanced.isEmpty()) {
            log.info("Escalation tick advanced {} instance(s)", advanced.size());
        }
        return advanced;
    }

    private Optional<EscalationInstance> runCycle(String instanceId, Instant now) {
        EscalationInstance instance = instanceRepository.findById(instanceId).orElse(null);
        if (instance == null || instance.getStatus() != EscalationStatus.PENDING
                || instance.getNextActionAt() == null || instance.getNextActionAt().isAfter(now)) {
            return Optional.empty();
        }

        EscalationRule rule = ruleRepository.findById(instance.getRuleId()).orElse(null);
        if (rule == null) {
            return Optional.of(finishWithoutActions(instance, EscalationStatus.CANCELLED, "Escalation rule deleted", now));
        }
        if (!subjectGateway.isSubjectOpen(instance.getSubjectId())) {
            return Optional.of(finishWithoutActions(instance, EscalationStatus.CANCELLED, "Subject closed", now));
        }
        if (subjectGateway.isSubjectResolved(instance.getSubjectId())) {
            return Optional.of(finishWithoutActions(instance, EscalationStatus.COMPLETED, "Subject resolved", now));
        }

        instance.setStatus(EscalationStatus.EXECUTING);
        instance.setUpdatedAt(now);
        try {
            instance = instanceRepository.save(instance);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("Escalation {} changed before its cycle started, skipping", instanceId);
            return Optional.empty();
        }
        recordTransition(instance, EscalationStatus.PENDING, EscalationStatus.EXECUTING, null);

        List<ExecutedAction> steps = List.of();
        try {
            steps = actionRunner.runAll(
                    rule.getActions() != null ? rule.getActions() : List.of(),
                    EscalationContext.of(instance, rule, now));

            instance.getExecutedActions().addAll(steps);
            instance.setLastActionAt(now);
            instance.setUpdatedAt(now);
            applyOutcome(instance, rule, steps, now);
            instance = instanceRepository.save(instance);
        } catch (ObjectOptimisticLockingFailureException e) {
            // Cancelled while the steps ran: keep CANCELLED, still record what ran
            EscalationInstance cancelled = instanceRepository.findById(instanceId).orElseThrow();
            cancelled.getExecutedActions().addAll(steps);
            cancelled.setLastActionAt(now);
            log.info("Escalation {} was cancelled during its level {} cycle", instanceId, cancelled.getEscalationLevel());
            return Optional.of(instanceRepository.save(cancelled));
        } catch (RuntimeException e) {
            return Optional.of(abortCycle(instanceId, e, now));
        }
        recordTransition(instance, EscalationStatus.EXECUTING, instance.getStatus(), instance.getStatusReason());
        return Optional.of(instance);
    }

    /**
     * A cycle that broke after EXECUTING was committed ends as FAILED, so no instance is left
     * EXECUTING until the next restart.
     */
    private EscalationInstance abortCycle(String instanceId, RuntimeException cause, Instant now) {
        String reason = "Cycle aborted: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        if (reason.length() > MAX_REASON_LENGTH) {
            reason = reason.substring(0, MAX_REASON_LENGTH);
        }
        log.error("Escalation {} cycle aborted: {}", instanceId, cause.getMessage(), cause);
        if (instanceRepository.failIfExecuting(instanceId, reason, now) == 0) {
            return instanceRepository.findById(instanceId).orElseThrow();
        }
        EscalationInstance failed = instanceRepository.findById(instanceId).orElseThrow();
        recordTransition(failed, EscalationStatus.EXECUTING, EscalationStatus.FAILED, reason);
        return failed;
    }

    private void applyOutcome(EscalationInstance instance, EscalationRule rule, List<ExecutedAction> steps, Instant now) {
        int level = instance.getEscalationLevel();
        boolean allFailed = !steps.isEmpty() && steps.stream().noneMatch(ExecutedAction::isSuccess);

        if (allFailed) {
            instance.setStatus(EscalationStatus.FAILED);
            instance.setStatusReason("All " + steps.size() + " action(s) failed at level " + level);
            instance.setNextActionAt(null);
            log.error("Escalation {} failed: every action of level {} errored", instance.getId(), level);
        } else if (subjectGateway.isSubjectResolved(instance.getSubjectId())) {
            instance.setStatus(EscalationStatus.COMPLETED);
            instance.setStatusReason("Subject resolved");
            instance.setNextActionAt(null);
        } else if (level >= rule.getMaxEscalations()) {
            instance.setStatus(EscalationStatus.COMPLETED);
            instance.setStatusReason("Reached max escalation level " + rule.getMaxEscalations());
            instance.setNextActionAt(null);
            log.info("Escalation {} completed at level {}", instance.getId(), level);
        } else {
            instance.setStatus(EscalationStatus.PENDING);
            instance.setEscalationLevel(level + 1);
            instance.setNextActionAt(now.plus(Duration.ofMinutes(rule.getCooldownPeriodMinutes())));
            instance.setStatusReason(null);
            log.info("Escalation {} moves to level {} at {}", instance.getId(), level + 1, instance.getNextActionAt());
        }
    }

    private EscalationInstance finishWithoutActions(EscalationInstance instance, EscalationStatus status,
                                                    String reason, Instant now) {
        EscalationStatus from = instance.getStatus();
        instance.setStatus(status);
        instance.setStatusReason(reason);
        instance.setNextActionAt(null);
        instance.setUpdatedAt(now);
        EscalationInstance saved = instanceRepository.save(instance);
        log.info("Escalation {} {}: {}", saved.getId(), status.name().toLowerCase(Locale.ROOT), reason);
        recordTransition(saved, from, status, reason);
        return saved;
    }

    /**
     * Cancels a non-terminal instance. Cancelling a terminal instance changes nothing.
     *
     * @return true if this call cancelled the instance
     */
    public boolean cancel(String instanceId, String reason) {
        EscalationInstance instance = getInstance(instanceId);
        String why = reason != null ? reason : "Cancelled";
        if (instanceRepository.cancelIfActive(instanceId, why, clock.instant()) == 0) {
            log.debug("Escalation {} already {}, cancel ignored", instanceId, instance.getStatus());
            return false;
        }
        log.info("Escalation {} cancelled: {}", instanceId, why);
        recordTransition(instance, instance.getStatus(), EscalationStatus.CANCELLED, why);
        return true;
    }

    public int cancelForSubject(String subjectId, String reason) {
        int cancelled = 0;
        for (EscalationInstance instance : instanceRepository.findBySubjectIdAndStatusIn(subjectId, EscalationStatus.ACTIVE)) {
            try {
                if (cancel(instance.getId(), reason)) {
                    cancelled++;
                }
            } catch (Exception e) {
                log.error("Failed to cancel escalation {}: {}", instance.getId(), e.getMessage(), e);
            }
        }
        return cancelled;
    }

    /**
     * An instance left EXECUTING by a stopped process goes back to PENDING so its cycle reruns.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedCycles() {
        for (EscalationInstance instance : instanceRepository.findByStatus(EscalationStatus.EXECUTING)) {
            try {
                instance.setStatus(EscalationStatus.PENDING);
                instance.setUpdatedAt(clock.instant());
                instanceRepository.save(instance);
                log.warn("Escalation {} was interrupted mid-cycle, rescheduled", instance.getId());
            } catch (Exception e) {
                log.error("Failed to recover escalation {}: {}", instance.getId(), e.getMessage(), e);
            }
        }
    }

    public EscalationInstance getInstance(String instanceId) {
        return instanceRepository.findById(instanceId)
                .orElseThrow(() -> new EntityNotFoundException("EscalationInstance", instanceId));
    }

    public List<EscalationInstance> getActiveInstances() {
        return instanceRepository.findByStatusInOrderByTriggeredAtDesc(EscalationStatus.ACTIVE);
    }

    public List<EscalationInstance> getInstancesForSubject(String subjectId) {
        return instanceRepository.findBySubjectIdOrderByTriggeredAtDesc(subjectId);
    }

    /**
     * Deletes terminal instances triggered before the retention window.
     */
    public int cleanup() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getEscalation().getRetentionDays()));
        int deleted = instanceRepository.deleteByStatusInAndTriggeredAtBefore(EscalationStatus.TERMINAL, cutoff);
        if (deleted > 0) {
            log.info("Removed {} finished escalation(s) older than {}", deleted, cutoff);
        }
        return deleted;
    }

    private void recordTransition(EscalationInstance instance, EscalationStatus from, EscalationStatus to, String reason) {
        meterRegistry.counter("servicedesk.escalations.transitions",
                "from", from != null ? from.name().toLowerCase(Locale.ROOT) : "none",
                "to", to.name().toLowerCase(Locale.ROOT)).increment();
        if (to == EscalationStatus.EXECUTING) {
            return;
        }
        auditService.log("escalation-manager", "ESCALATION_" + to.name(), instance.getId(), Map.of(
                "rule_id", instance.getRuleId(),
                "subject_id", instance.getSubjectId(),
                "level", instance.getEscalationLevel(),
                "reason", reason != null ? reason : ""), to != EscalationStatus.FAILED);
    }
}
