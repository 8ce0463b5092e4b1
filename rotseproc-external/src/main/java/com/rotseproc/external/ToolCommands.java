package com.rotseproc.external;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Command prefixes for the tools the pipeline delegates to, keyed by a logical tool name.
 * A stage appends its own arguments to the prefix.
 */
public final class ToolCommands {
    public static final String IDL = "idl";
    public static final String SEXTRACTOR = "sextractor";
    public static final String DIFFERENCE = "difference";
    public static final String CALIBRATE = "calibrate";

    private final Map<String, List<String>> prefixes;

    private ToolCommands(Map<String, List<String>> prefixes) {
        this.prefixes = prefixes;
    }

    /** IDL inside the site's container image, SExtractor and the differencing script from the PATH. */
    public static ToolCommands defaults() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(IDL, List.of("singularity", "run", "--bind", "/scratch", "/hpc/applications/idl/idl_8.0.simg", "-32", "-e"));
        m.put(SEXTRACTOR, List.of("sex"));
        m.put(DIFFERENCE, List.of("difference_all.py"));
        return new ToolCommands(Collections.unmodifiableMap(m));
    }

    public static ToolCommands of(Map<String, List<String>> prefixes) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (var e : Objects.requireNonNull(prefixes, "prefixes").entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) {
                throw new IllegalArgumentException("Tool '" + e.getKey() + "' needs a non-empty command");
            }
            m.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return new ToolCommands(Collections.unmodifiableMap(m));
    }

    /** These commands with {@code overrides} replacing or adding entries. */
    public ToolCommands with(Map<String, List<String>> overrides) {
        Map<String, List<String>> m = new LinkedHashMap<>(prefixes);
        m.putAll(of(overrides).prefixes);
        return new ToolCommands(Collections.unmodifiableMap(m));
    }

    public boolean has(String tool) {
        return prefixes.containsKey(tool);
    }

    public Optional<List<String>> prefix(String tool) {
        return Optional.ofNullable(prefixes.get(tool));
    }

    public List<String> command(String tool, List<String> args) {
        List<String> prefix = prefixes.get(tool);
        if (prefix == null) throw new IllegalArgumentException("No command configured for tool '" + tool + "'");
        List<String> out = new ArrayList<>(prefix);
        out.addAll(args);
        return out;
    }

    public Map<String, List<String>> asMap() {
        return prefixes;
    }
}
