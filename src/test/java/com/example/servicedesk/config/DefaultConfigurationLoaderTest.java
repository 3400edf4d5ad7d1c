package com.example.servicedesk.config;

import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.FilterAction;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.GroupingStrategy;
import com.example.servicedesk.support.EngineIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultConfigurationLoaderTest extends EngineIntegrationTest {

    @Autowired
    private DefaultConfigurationLoader loader;

    @Autowired
    private NotificationEngineProperties properties;

    @Test
    void seedsEmptyTablesFromDefaults() {
        seedWithDefaultsEnabled();

        assertEquals(6, batchConfigRepository.count());
        assertEquals(4, filterRuleRepository.count());
        assertEquals(3, escalationRuleRepository.count());

        BatchConfiguration slaWarnings = batchConfigRepository.findById("sla_warnings").orElseThrow();
        assertEquals(20, slaWarnings.getMaxBatchSize());
        assertEquals(120_000, slaWarnings.getMaxWaitTimeMs());
        assertEquals(GroupingStrategy.PRIORITY, slaWarnings.getGroupBy());
        assertTrue(slaWarnings.getEventTypes().contains("sla_breach"));

        List<FilterRule> rules = filterRuleRepository.findAll().stream()
                .sorted(Comparator.comparingInt(FilterRule::getPriority))
                .toList();
        assertEquals(FilterAction.ALLOW, rules.get(0).getAction());
        assertEquals(FilterAction.DELAY, rules.get(3).getAction());
        assertNotNull(rules.get(0).getCreatedAt());

        escalationRuleRepository.findAll().forEach(rule -> assertEquals("system", rule.getCreatedBy()));
    }

    @Test
    void secondRunLeavesExistingConfigurationAlone() {
        saveBatchConfig("digest_email", 3, 1_000, GroupingStrategy.USER);

        seedWithDefaultsEnabled();
        seedWithDefaultsEnabled();

        assertEquals(1, batchConfigRepository.count());
        assertEquals(3, batchConfigRepository.findById("digest_email").orElseThrow().getMaxBatchSize());
        assertEquals(4, filterRuleRepository.count());
        assertEquals(3, escalationRuleRepository.count());
    }

    @Test
    void disabledSeedingDoesNothing() {
        loader.seedDefaults();

        assertEquals(0, batchConfigRepository.count());
        assertEquals(0, filterRuleRepository.count());
    }

    @Test
    void missingDefaultsFileLoadsEmpty() throws Exception {
        NotificationDefaults defaults = loader.load("classpath:defaults/does-not-exist.yml");

        assertTrue(defaults.getBatchConfigurations().isEmpty());
        assertTrue(defaults.getEscalationRules().isEmpty());
    }

    private void seedWithDefaultsEnabled() {
        properties.setSeedDefaults(true);
        try {
            loader.seedDefaults();
        } finally {
            properties.setSeedDefaults(false);
        }
    }
}
