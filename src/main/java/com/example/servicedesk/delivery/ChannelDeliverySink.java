package com.example.servicedesk.delivery;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.NotificationBatch;
import com.example.servicedesk.exception.DeliveryException;
import com.example.servicedesk.exception.PermanentDeliveryException;
import com.example.servicedesk.exception.TransientDeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers batch digests to the configured webhook and Slack channels.
 * Every request carries the batch id as its Idempotency-Key so receivers can drop resends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelDeliverySink implements DeliverySink {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private static final MediaType JSON = MediaType.get("application/json");

    private final NotificationEngineProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BatchDigestFormatter digestFormatter;

    @Override
    public void deliver(NotificationBatch batch) throws DeliveryException {
        NotificationEngineProperties.DeliveryConfig delivery = properties.getDelivery();
        BatchDigest digest = digestFormatter.format(batch);

        boolean webhook = delivery.getWebhook().isEnabled();
        boolean slack = delivery.getSlack().isEnabled();
        if (!webhook && !slack) {
            log.info("No delivery channel enabled; batch {} ({} notifications for {}) recorded only: {}",
                    batch.getId(), batch.size(), batch.getTargetUserIds(), digest.getTitle());
            return;
        }

        if (webhook) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("batch_id", batch.getId());
            body.put("batch_key", batch.getBatchKey());
            body.put("group_key", batch.getGroupKey());
            body.put("target_user_ids", batch.getTargetUserIds());
            body.put("digest", digest);
            body.put("notifications", batch.getNotifications());
            post("webhook", delivery.getWebhook().getUrl(), batch.getId(), body);
        }

        if (slack) {
            Map<String, Object> body = Map.of(
                    "text", String.format("*%s* (%s)\n%s",
                            digest.getTitle(), digest.getPriority().wireName(), digest.getMessage()),
                    "username", "Service Desk"
            );
            post("slack", delivery.getSlack().getWebhookUrl(), batch.getId(), body);
        }
    }

    private void post(String channel, String url, String batchId, Map<String, Object> body) throws DeliveryException {
        if (url == null || url.isEmpty()) {
            throw new PermanentDeliveryException(channel + " URL not configured");
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PermanentDeliveryException("Cannot serialize batch " + batchId + ": " + e.getOriginalMessage());
        }

        Request request = new Request.Builder()
                .url(url)
                .header(IDEMPOTENCY_HEADER, batchId)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            if (response.isSuccessful()) {
                log.info("Batch {} delivered to {}", batchId, channel);
                return;
            }
            if (code == 429 || code >= 500) {
                throw new TransientDeliveryException(channel + " returned " + code);
            }
            throw new PermanentDeliveryException(channel + " rejected batch with " + code);
        } catch (IOException e) {
            throw new TransientDeliveryException(channel + " unreachable: " + e.getMessage(), e);
        }
    }
}
