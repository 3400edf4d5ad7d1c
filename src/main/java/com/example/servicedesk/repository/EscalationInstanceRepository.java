package com.example.servicedesk.repository;

import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EscalationInstanceRepository extends JpaRepository<EscalationInstance, String> {

    Optional<EscalationInstance> findFirstByRuleIdAndSubjectIdAndStatusIn(
            String ruleId, String subjectId, Collection<EscalationStatus> statuses);

    List<EscalationInstance> findByStatusAndNextActionAtLessThanEqualOrderByNextActionAtAsc(
            EscalationStatus status, Instant deadline);

    List<EscalationInstance> findBySubjectIdAndStatusIn(String subjectId, Collection<EscalationStatus> statuses);

    List<EscalationInstance> findByStatusInOrderByTriggeredAtDesc(Collection<EscalationStatus> statuses);

    List<EscalationInstance> findBySubjectIdOrderByTriggeredAtDesc(String subjectId);

    List<EscalationInstance> findByStatus(EscalationStatus status);

    /**
     * Cancels the instance if it is still PENDING or EXECUTING. Returns 0 for a terminal instance.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE EscalationInstance e SET e.status = com.example.servicedesk.domain.EscalationStatus.CANCELLED, " +
           "e.statusReason = :reason, e.updatedAt = :at, e.nextActionAt = NULL, e.version = e.version + 1 " +
           "WHERE e.id = :id AND e.status IN (com.example.servicedesk.domain.EscalationStatus.PENDING, " +
           "com.example.servicedesk.domain.EscalationStatus.EXECUTING)")
    int cancelIfActive(String id, String reason, Instant at);

    /** Ends a cycle that could not be committed. Returns 0 when the instance already left EXECUTING. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE EscalationInstance e SET e.status = com.example.servicedesk.domain.EscalationStatus.FAILED, " +
           "e.statusReason = :reason, e.updatedAt = :at, e.nextActionAt = NULL, e.version = e.version + 1 " +
           "WHERE e.id = :id AND e.status = com.example.servicedesk.domain.EscalationStatus.EXECUTING")
    int failIfExecuting(String id, String reason, Instant at);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM EscalationInstance e WHERE e.status IN :statuses AND e.triggeredAt < :cutoff")
    int deleteByStatusInAndTriggeredAtBefore(Collection<EscalationStatus> statuses, Instant cutoff);
}
