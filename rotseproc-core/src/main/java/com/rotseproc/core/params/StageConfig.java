package com.rotseproc.core.params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Raw parameter blocks keyed by stage name, fixed before a run starts. A stage without an entry
 * has no parameter block at all, which is distinct from an empty block.
 */
public final class StageConfig {
    private final Map<String, Map<String, Object>> blocks;

    private StageConfig(Map<String, Map<String, Object>> blocks) {
        this.blocks = blocks;
    }

    public static StageConfig of(Map<String, ? extends Map<String, ?>> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        for (var e : blocks.entrySet()) {
            if (e.getValue() == null) continue;
            copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        return new StageConfig(Collections.unmodifiableMap(copy));
    }

    public static StageConfig empty() {
        return new StageConfig(Map.of());
    }

    public Optional<Map<String, Object>> block(String stageName) {
        return Optional.ofNullable(blocks.get(stageName));
    }

    public Set<String> stageNames() {
        return blocks.keySet();
    }
}
