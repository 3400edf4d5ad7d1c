package com.example.servicedesk.batching;

import com.example.servicedesk.domain.NotificationEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds delayed events outside any batch until their release time passes.
 * Events with equal release times come out in submission order.
 */
@Component
public class DeferredSubmissionQueue {

    private record Deferred(NotificationEvent event, Instant releaseAt, long sequence) {}

    private final PriorityQueue<Deferred> queue = new PriorityQueue<>(
            Comparator.comparing(Deferred::releaseAt).thenComparingLong(Deferred::sequence));
    private final AtomicLong sequence = new AtomicLong();

    public synchronized void defer(NotificationEvent event, Instant releaseAt) {
        queue.add(new Deferred(event, releaseAt, sequence.incrementAndGet()));
    }

    /**
     * Removes and returns every event whose release time is at or before {@code now}.
     */
    public synchronized List<NotificationEvent> drainDue(Instant now) {
        List<NotificationEvent> due = new ArrayList<>();
        while (!queue.isEmpty() && !queue.peek().releaseAt().isAfter(now)) {
            due.add(queue.poll().event());
        }
        return due;
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized void clear() {
        queue.clear();
    }
}
