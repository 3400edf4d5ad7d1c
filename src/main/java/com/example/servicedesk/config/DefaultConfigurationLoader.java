package com.example.servicedesk.config;

import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.exception.InvalidConfigurationException;
import com.example.servicedesk.repository.BatchConfigurationRepository;
import com.example.servicedesk.repository.EscalationRuleRepository;
import com.example.servicedesk.repository.FilterRuleRepository;
import com.example.servicedesk.service.ConfigurationValidator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Seeds the default batch configurations, filter rules and escalation rules from YAML.
 * Each table is seeded only while it is empty, so admin edits survive restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultConfigurationLoader {

    private final NotificationEngineProperties properties;
    private final ResourceLoader resourceLoader;
    private final BatchConfigurationRepository batchConfigRepository;
    private final FilterRuleRepository filterRuleRepository;
    private final EscalationRuleRepository escalationRuleRepository;
    private final ConfigurationValidator validator;
    private final Clock clock;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @EventListener(ApplicationReadyEvent.class)
    public void seedDefaults() {
        if (!properties.isSeedDefaults()) {
            log.info("Default notification configuration seeding disabled");
            return;
        }
        NotificationDefaults defaults;
        try {
            defaults = load(properties.getDefaultsLocation());
        } catch (IOException e) {
            log.error("Failed to read notification defaults from {}: {}", properties.getDefaultsLocation(), e.getMessage());
            return;
        }
        Instant now = clock.instant();

        if (batchConfigRepository.count() == 0) {
            int seeded = seed(defaults.getBatchConfigurations(), (BatchConfiguration config) -> {
                validator.validate(config);
                config.setUpdatedAt(now);
                batchConfigRepository.save(config);
            });
            log.info("Seeded {} default batch configuration(s)", seeded);
        }
        if (filterRuleRepository.count() == 0) {
            int seeded = seed(defaults.getFilterRules(), (FilterRule rule) -> {
                validator.validate(rule);
                rule.setId(null);
                rule.setCreatedAt(now);
                rule.setUpdatedAt(now);
                filterRuleRepository.save(rule);
            });
            log.info("Seeded {} default filter rule(s)", seeded);
        }
        if (escalationRuleRepository.count() == 0) {
            int seeded = seed(defaults.getEscalationRules(), (EscalationRule rule) -> {
                validator.validate(rule);
                rule.setId(null);
                rule.setCreatedBy(rule.getCreatedBy() != null ? rule.getCreatedBy() : "system");
                rule.setCreatedAt(now);
                rule.setUpdatedAt(now);
                escalationRuleRepository.save(rule);
            });
            log.info("Seeded {} default escalation rule(s)", seeded);
        }
    }

    NotificationDefaults load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Notification defaults not found at {}", location);
            return new NotificationDefaults();
        }
        try (InputStream in = resource.getInputStream()) {
            return yamlMapper.readValue(in, NotificationDefaults.class);
        }
    }

    private static <T> int seed(Iterable<T> items, Consumer<T> saver) {
        int seeded = 0;
        for (T item : items) {
            try {
                saver.accept(item);
                seeded++;
            } catch (InvalidConfigurationException e) {
                log.warn("Skipping invalid default {}: {}", item.getClass().getSimpleName(), e.getViolations());
            }
        }
        return seeded;
    }
}
