package com.example.servicedesk.escalation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class EscalationActionRegistry {

    private final Map<EscalationActionType, EscalationActionHandler> handlers = new EnumMap<>(EscalationActionType.class);

    public EscalationActionRegistry(List<EscalationActionHandler> allHandlers) {
        for (EscalationActionHandler handler : allHandlers) {
            handlers.put(handler.getType(), handler);
        }
        log.info("Registered {} escalation action handler(s): {}", handlers.size(), handlers.keySet());
    }

    public Optional<EscalationActionHandler> getHandler(String type) {
        return EscalationActionType.parse(type).map(handlers::get);
    }

    public boolean isSupported(String type) {
        return getHandler(type).isPresent();
    }
}
