package com.example.servicedesk.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Per-user send times over the last day, the basis of the hourly and daily limits.
 * Held in memory only, so the counts start from zero after a restart.
 */
@Component
public class RecipientFrequencyTracker {

    static final Duration WINDOW = Duration.ofDays(1);

    private final Cache<String, Deque<Instant>> history = Caffeine.newBuilder()
            .expireAfterAccess(WINDOW)
            .maximumSize(100_000)
            .build();

    public void record(Collection<String> userIds, Instant at) {
        Instant horizon = at.minus(WINDOW);
        for (String userId : userIds) {
            Deque<Instant> sent = history.get(userId, id -> new ConcurrentLinkedDeque<>());
            sent.addLast(at);
            sent.removeIf(time -> !time.isAfter(horizon));
        }
    }

    /** Notifications recorded for the user strictly after {@code since}. */
    public long countSince(String userId, Instant since) {
        Deque<Instant> sent = history.getIfPresent(userId);
        if (sent == null) {
            return 0;
        }
        return sent.stream().filter(time -> time.isAfter(since)).count();
    }

    public void clear() {
        history.invalidateAll();
    }
}
