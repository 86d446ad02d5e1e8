package io.herald.core.schedule;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class CallbackRegistry {
    private final Map<String, JobCallback> callbacks = new ConcurrentHashMap<>();

    public void register(String name, JobCallback callback) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("callback name must not be blank");
        }
        callbacks.put(name.trim(), callback);
    }

    public Optional<JobCallback> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(callbacks.get(name.trim()));
    }

    public Set<String> names() {
        return new TreeSet<>(callbacks.keySet());
    }
}
