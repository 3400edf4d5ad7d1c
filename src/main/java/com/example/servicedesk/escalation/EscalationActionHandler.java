package com.example.servicedesk.escalation;

import com.example.servicedesk.domain.EscalationAction;

/**
 * Executes one type of escalation step. A handler reports an expected failure as a
 * failed {@link ActionOutcome}; anything it throws is recorded as a failed attempt too.
 */
public interface EscalationActionHandler {

    EscalationActionType getType();

    ActionOutcome execute(EscalationAction action, EscalationContext context);
}
