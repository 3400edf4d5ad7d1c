package com.example.servicedesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Service Desk Notification Engine
 *
 * Decides whether, when and how often users hear about ticket events,
 * and escalates unattended tickets through a chain of responders.
 *
 * Architecture:
 * - Filter Engine → ordered rule evaluation (block / allow / delay / modify / priority change)
 * - Batching Engine → time and size bounded batches keyed by a grouping strategy
 * - Delivery → bounded, retried handoff of flushed batches to delivery channels
 * - Escalation Manager → multi-level escalation instances with cooldowns
 * - Sweep Scheduler → single clock driving batch flush and escalation ticks
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class ServiceDeskNotificationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceDeskNotificationApplication.class, args);
    }
}
