package com.rotseproc.core;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Stage factories addressable by a configuration key such as {@code "coaddition"}. */
public final class StageRegistry {
    /** Builds a stage under the configured name; a null or blank name selects the stage's default. */
    @FunctionalInterface
    public interface StageFactory {
        Stage<?> create(String name);
    }

    private final Map<String, StageFactory> factories = new ConcurrentHashMap<>();

    public StageRegistry register(String key, StageFactory factory) {
        factories.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    public boolean has(String key) { return factories.containsKey(key); }

    public Stage<?> create(String key, String name) {
        StageFactory factory = factories.get(key);
        if (factory == null) throw new IllegalArgumentException("Unknown stage: " + key);
        return Objects.requireNonNull(factory.create(name), "factory returned null for " + key);
    }

    public Set<String> keys() {
        return new TreeSet<>(factories.keySet());
    }
}
