package com.example.servicedesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the notification engine.
 * Maps to the 'service-desk' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "service-desk")
public class NotificationEngineProperties {

    /** YAML file with the default filter rules, batch configurations and escalation rules */
    private String defaultsLocation = "classpath:defaults/notification-defaults.yml";

    /** Seed the defaults into empty configuration tables at startup */
    private boolean seedDefaults = true;

    private SchedulerConfig scheduler = new SchedulerConfig();
    private FilterConfig filter = new FilterConfig();
    private BatchingConfig batching = new BatchingConfig();
    private DeliveryConfig delivery = new DeliveryConfig();
    private EscalationConfig escalation = new EscalationConfig();

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        private long sweepIntervalMs = 5000;
        private String cleanupCron = "0 0 * * * *";
    }

    @Data
    public static class FilterConfig {
        private int defaultDelayMinutes = 30;
        /** Longest delay a delay rule may ask for (30 days) */
        private long maxDelayMinutes = 43200;
    }

    @Data
    public static class BatchingConfig {
        private String defaultBatchKey = "digest_email";
        private boolean bypassCritical = true;
        private List<String> immediateTypes = new ArrayList<>(
                List.of("password_reset", "login_alert", "security_alert"));
        private int retentionDays = 30;
    }

    @Data
    public static class DeliveryConfig {
        /** Hand flushed batches to the delivery executor instead of the flushing thread */
        private boolean async = true;
        private long timeoutMs = 10000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 30000;
        /** Extra time past the timeout before a READY batch is considered stalled */
        private long stalledGraceMs = 60000;
        private WebhookConfig webhook = new WebhookConfig();
        private SlackConfig slack = new SlackConfig();

        @Data
        public static class WebhookConfig {
            private boolean enabled = false;
            private String url = "";
        }

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }
    }

    @Data
    public static class EscalationConfig {
        /** Attempts per action step within one escalation cycle */
        private int actionMaxAttempts = 2;
        private int defaultTriggerDelayMinutes = 0;
        private int retentionDays = 30;
        /** Role name -> user ids notified by notify_role steps */
        private Map<String, List<String>> roleMembers = new LinkedHashMap<>();
    }
}
