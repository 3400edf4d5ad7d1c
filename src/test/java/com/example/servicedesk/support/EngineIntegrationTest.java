package com.example.servicedesk.support;

import com.example.servicedesk.batching.DeferredSubmissionQueue;
import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.GroupingStrategy;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.filter.RecipientFrequencyTracker;
import com.example.servicedesk.repository.BatchConfigurationRepository;
import com.example.servicedesk.repository.EscalationInstanceRepository;
import com.example.servicedesk.repository.EscalationRuleRepository;
import com.example.servicedesk.repository.FilterRuleRepository;
import com.example.servicedesk.repository.NotificationBatchRepository;
import com.example.servicedesk.repository.UserNotificationPreferencesRepository;
import com.example.servicedesk.subject.TicketStateRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Full context on in-memory H2 with the scheduler off, inline delivery and a hand-driven clock.
 * State is wiped before each test so the shared context can be reused.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestEngineConfiguration.class)
public abstract class EngineIntegrationTest {

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected RecordingDeliverySink sink;

    @Autowired
    protected NotificationBatchRepository batchRepository;

    @Autowired
    protected BatchConfigurationRepository batchConfigRepository;

    @Autowired
    protected FilterRuleRepository filterRuleRepository;

    @Autowired
    protected EscalationRuleRepository escalationRuleRepository;

    @Autowired
    protected EscalationInstanceRepository escalationInstanceRepository;

    @Autowired
    protected UserNotificationPreferencesRepository preferencesRepository;

    @Autowired
    protected RecipientFrequencyTracker frequencyTracker;

    @Autowired
    protected DeferredSubmissionQueue deferredQueue;

    @Autowired
    protected TicketStateRegistry ticketStateRegistry;

    @BeforeEach
    void resetEngineState() {
        batchRepository.deleteAll();
        batchConfigRepository.deleteAll();
        filterRuleRepository.deleteAll();
        escalationInstanceRepository.deleteAll();
        escalationRuleRepository.deleteAll();
        preferencesRepository.deleteAll();
        frequencyTracker.clear();
        deferredQueue.clear();
        ticketStateRegistry.clear();
        sink.reset();
        clock.reset();
    }

    protected BatchConfiguration saveBatchConfig(String batchKey, int maxBatchSize, long maxWaitTimeMs,
                                                 GroupingStrategy groupBy, String... eventTypes) {
        return batchConfigRepository.save(BatchConfiguration.builder()
                .batchKey(batchKey)
                .maxBatchSize(maxBatchSize)
                .maxWaitTimeMs(maxWaitTimeMs)
                .groupBy(groupBy)
                .eventTypes(new LinkedHashSet<>(List.of(eventTypes)))
                .active(true)
                .updatedAt(clock.instant())
                .build());
    }

    protected NotificationEvent event(String type, String ticketId, String... targets) {
        return NotificationEvent.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .ticketId(ticketId)
                .authorId("agent-7")
                .priority(NotificationPriority.MEDIUM)
                .targetUserIds(new ArrayList<>(List.of(targets)))
                .payload(new LinkedHashMap<>(Map.of("title", type + " on " + ticketId)))
                .occurredAt(clock.instant())
                .build();
    }
}
