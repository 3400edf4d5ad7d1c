package com.example.servicedesk.subject;

import com.example.servicedesk.domain.NotificationPriority;

import java.util.Optional;

/**
 * What the escalation engine needs to know about, and may change on, an escalation subject (a ticket).
 */
public interface SubjectGateway {

    /** False once the subject is closed or deleted; active escalations are then cancelled. */
    boolean isSubjectOpen(String subjectId);

    /** True once the subject no longer needs escalating, e.g. acknowledged or resolved. */
    boolean isSubjectResolved(String subjectId);

    Optional<String> getAssignee(String subjectId);

    /** @return the previous assignee, if any */
    Optional<String> reassign(String subjectId, String assigneeId);

    /** @return the previous priority, if known */
    Optional<NotificationPriority> changePriority(String subjectId, NotificationPriority priority);

    Optional<NotificationPriority> getPriority(String subjectId);
}
