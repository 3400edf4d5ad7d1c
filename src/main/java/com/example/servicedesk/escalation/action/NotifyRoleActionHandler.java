package com.example.servicedesk.escalation.action;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.escalation.ActionOutcome;
import com.example.servicedesk.escalation.EscalationActionHandler;
import com.example.servicedesk.escalation.EscalationActionType;
import com.example.servicedesk.escalation.EscalationAlertPublisher;
import com.example.servicedesk.escalation.EscalationContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * parameters: role, optional excludeUsers and channels.
 * Members come from service-desk.escalation.role-members; a role without configured
 * members is addressed as "role:&lt;name&gt;" and left to the delivery channel to expand.
 */
@Component
@RequiredArgsConstructor
public class NotifyRoleActionHandler implements EscalationActionHandler {

    private final EscalationAlertPublisher alertPublisher;
    private final NotificationEngineProperties properties;

    @Override
    public EscalationActionType getType() {
        return EscalationActionType.NOTIFY_ROLE;
    }

    @Override
    public ActionOutcome execute(EscalationAction action, EscalationContext context) {
        Map<String, Object> params = action.getParameters() != null ? action.getParameters() : Map.of();
        Object role = params.get("role");
        if (role == null || role.toString().isBlank()) {
            return ActionOutcome.failure("notify_role requires role");
        }
        String roleName = role.toString();
        List<String> excluded = params.get("excludeUsers") instanceof Collection<?> c
                ? c.stream().map(String::valueOf).toList()
                : List.of();

        List<String> members = properties.getEscalation().getRoleMembers().getOrDefault(roleName, List.of());
        List<String> targets = members.isEmpty()
                ? List.of("role:" + roleName)
                : members.stream().filter(m -> !excluded.contains(m)).toList();
        if (targets.isEmpty()) {
            return ActionOutcome.failure("Every member of role " + roleName + " is excluded");
        }

        NotificationEvent alert = EscalationAlerts.alert(context, targets, NotificationPriority.HIGH,
                "Escalation Alert - " + roleName.toUpperCase(Locale.ROOT),
                "Ticket " + context.getSubjectId() + " has been escalated to the " + roleName + " team",
                params.get("channels"));
        alertPublisher.publish(alert);
        return ActionOutcome.success(Map.of("notifiedRole", roleName, "recipients", targets, "alertId", alert.getId()));
    }
}
