package com.example.servicedesk.escalation.action;

import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.escalation.ActionOutcome;
import com.example.servicedesk.escalation.EscalationActionHandler;
import com.example.servicedesk.escalation.EscalationActionType;
import com.example.servicedesk.escalation.EscalationContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs the escalation to an external URL.
 * parameters: url, optional customData.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookActionHandler implements EscalationActionHandler {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public EscalationActionType getType() {
        return EscalationActionType.WEBHOOK;
    }

    @Override
    public ActionOutcome execute(EscalationAction action, EscalationContext context) {
        Map<String, Object> params = action.getParameters() != null ? action.getParameters() : Map.of();
        Object url = params.get("url");
        if (url == null || url.toString().isBlank()) {
            return ActionOutcome.failure("webhook requires url");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escalationId", context.getInstanceId());
        payload.put("ruleId", context.getRule().getId());
        payload.put("ruleName", context.getRule().getName());
        payload.put("subjectId", context.getSubjectId());
        payload.put("notificationId", context.getNotificationId());
        payload.put("escalationLevel", context.getEscalationLevel());
        payload.put("timestamp", context.getNow().toString());
        payload.put("customData", params.get("customData"));

        try {
            Request request = new Request.Builder()
                    .url(url.toString())
                    .header("Idempotency-Key", context.getInstanceId() + "-" + context.getEscalationLevel())
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    return ActionOutcome.failure("Webhook returned " + response.code());
                }
                ResponseBody body = response.body();
                String text = body != null ? body.string() : "";
                return ActionOutcome.success(Map.of("status", response.code(),
                        "response", text.length() > 500 ? text.substring(0, 500) : text));
            }
        } catch (IOException e) {
            log.warn("Escalation webhook {} failed: {}", url, e.getMessage());
            return ActionOutcome.failure("Webhook call failed: " + e.getMessage());
        }
    }
}
