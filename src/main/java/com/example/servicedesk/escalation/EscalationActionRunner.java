package com.example.servicedesk.escalation;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.ExecutedAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the steps of one escalation cycle in order. Every step runs even when an
 * earlier one failed; a failing step is retried up to the configured attempt count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationActionRunner {

    private final EscalationActionRegistry actionRegistry;
    private final NotificationEngineProperties properties;

    public List<ExecutedAction> runAll(List<EscalationAction> actions, EscalationContext context) {
        List<ExecutedAction> executed = new ArrayList<>();
        for (EscalationAction action : actions) {
            executed.add(runStep(action, context));
        }
        return executed;
    }

    ExecutedAction runStep(EscalationAction action, EscalationContext context) {
        String type = action != null ? action.getType() : null;
        EscalationActionHandler handler = actionRegistry.getHandler(type).orElse(null);
        if (handler == null) {
            log.warn("Escalation {} has unknown action type '{}'", context.getInstanceId(), type);
            return record(type, context, ActionOutcome.failure("Unknown action type: " + type), 0);
        }

        int maxAttempts = Math.max(1, properties.getEscalation().getActionMaxAttempts());
        ActionOutcome outcome = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            try {
                outcome = handler.execute(action, context);
            } catch (Exception e) {
                outcome = ActionOutcome.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            if (outcome.success()) {
                break;
            }
            attempt++;
            if (attempt < maxAttempts) {
                log.debug("Retrying {} for escalation {} after: {}", type, context.getInstanceId(), outcome.error());
            }
        }

        int retries = outcome.success() ? attempt : maxAttempts - 1;
        if (outcome.success()) {
            log.info("Executed {} for escalation {} (level {})", type, context.getInstanceId(), context.getEscalationLevel());
        } else {
            log.error("Action {} failed for escalation {} after {} attempt(s): {}",
                    type, context.getInstanceId(), maxAttempts, outcome.error());
        }
        return record(type, context, outcome, retries);
    }

    private ExecutedAction record(String type, EscalationContext context, ActionOutcome outcome, int retryCount) {
        return ExecutedAction.builder()
                .actionType(type)
                .escalationLevel(context.getEscalationLevel())
                .executedAt(context.getNow())
                .success(outcome.success())
                .result(outcome.result() != null ? outcome.result() : Map.of())
                .error(outcome.error())
                .retryCount(retryCount)
                .build();
    }
}
