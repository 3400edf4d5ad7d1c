package com.example.servicedesk.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class TestEngineConfiguration {

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock();
    }

    @Bean
    @Primary
    public RecordingDeliverySink recordingDeliverySink() {
        return new RecordingDeliverySink();
    }
}
