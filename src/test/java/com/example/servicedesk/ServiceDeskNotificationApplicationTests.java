package com.example.servicedesk;

import com.example.servicedesk.batching.CustomGrouperRegistry;
import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.escalation.EscalationActionRegistry;
import com.example.servicedesk.escalation.EscalationActionType;
import com.example.servicedesk.support.TestEngineConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestEngineConfiguration.class)
class ServiceDeskNotificationApplicationTests {

    @Autowired
    private NotificationEngineProperties properties;

    @Autowired
    private EscalationActionRegistry actionRegistry;

    @Autowired
    private CustomGrouperRegistry grouperRegistry;

    @Test
    void contextLoads() {
        assertNotNull(properties);
        assertNotNull(actionRegistry);
        assertNotNull(grouperRegistry);
    }

    @Test
    void everyEscalationActionHasAHandler() {
        for (EscalationActionType type : EscalationActionType.values()) {
            assertTrue(actionRegistry.isSupported(type.wireName()), "No handler for " + type);
        }
        assertFalse(actionRegistry.isSupported("create_ticket"));
    }

    @Test
    void builtInGroupersAreRegistered() {
        assertTrue(grouperRegistry.isRegistered("ticket_and_type"));
        assertTrue(grouperRegistry.isRegistered("author"));
    }

    @Test
    void configurationIsLoaded() {
        assertEquals("digest_email", properties.getBatching().getDefaultBatchKey());
        assertFalse(properties.isSeedDefaults());
        assertFalse(properties.getScheduler().isEnabled());
        assertEquals(3, properties.getDelivery().getMaxAttempts());
        assertEquals(List.of("manager-1", "manager-2"),
                properties.getEscalation().getRoleMembers().get("manager"));
    }
}
