package com.example.servicedesk.locking;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-entity mutual exclusion. Each key gets its own lock; unrelated keys never contend.
 * Locks are weakly held, so keys of finished batches and instances do not accumulate.
 */
@Component
public class EntityLockRegistry {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public static String batchGroupKey(String batchKey, String groupKey) {
        return "batch:" + batchKey + "|" + groupKey;
    }

    public static String escalationSubjectKey(String ruleId, String subjectId) {
        return "escalation-subject:" + ruleId + "|" + subjectId;
    }

    public static String escalationInstanceKey(String instanceId) {
        return "escalation:" + instanceId;
    }
}
