package com.example.servicedesk.batching;

import com.example.servicedesk.domain.NotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide registry of custom grouping functions, looked up by grouper id.
 * Populated from {@link CustomGrouper} beans when the context starts; further
 * groupers can be registered explicitly.
 */
@Slf4j
@Component
public class CustomGrouperRegistry {

    private final Map<String, CustomGrouper> groupers = new ConcurrentHashMap<>();

    public CustomGrouperRegistry(List<CustomGrouper> builtIn) {
        builtIn.forEach(this::register);
    }

    public void register(CustomGrouper grouper) {
        CustomGrouper previous = groupers.put(grouper.getId(), grouper);
        if (previous != null) {
            log.warn("Custom grouper '{}' replaced", grouper.getId());
        } else {
            log.info("Registered custom grouper: {}", grouper.getId());
        }
    }

    public void register(String id, Function<NotificationEvent, String> function) {
        register(new CustomGrouper() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public String groupKey(NotificationEvent event) {
                return function.apply(event);
            }
        });
    }

    public void unregister(String id) {
        groupers.remove(id);
    }

    public Optional<CustomGrouper> getGrouper(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(groupers.get(id));
    }

    public boolean isRegistered(String id) {
        return id != null && groupers.containsKey(id);
    }

    public Set<String> getIds() {
        return new TreeSet<>(groupers.keySet());
    }
}
