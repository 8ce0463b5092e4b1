package com.rotseproc.core.params;

import com.rotseproc.core.exception.ConfigurationException;
import com.rotseproc.qa.Interval;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/** A validated, typed parameter block for one stage. Immutable. */
public final class StageParameters {
    private final String stageName;
    private final ParameterSchema schema;
    private final Map<String, Object> values;
    private final Map<String, Object> snapshot;

    StageParameters(String stageName, ParameterSchema schema, Map<String, Object> values, Map<String, Object> snapshot) {
        this.stageName = Objects.requireNonNull(stageName, "stageName");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }

    public String stageName() {
        return stageName;
    }

    public boolean has(String key) {
        return values.containsKey(declared(key));
    }

    public double number(String key) {
        return require(key, Double.class);
    }

    public OptionalDouble optionalNumber(String key) {
        Double d = optional(key, Double.class);
        return d == null ? OptionalDouble.empty() : OptionalDouble.of(d);
    }

    public long integer(String key) {
        return require(key, Long.class);
    }

    public String text(String key) {
        return require(key, String.class);
    }

    public Optional<String> optionalText(String key) {
        return Optional.ofNullable(optional(key, String.class));
    }

    public Path path(String key) {
        return require(key, Path.class);
    }

    public Optional<Path> optionalPath(String key) {
        return Optional.ofNullable(optional(key, Path.class));
    }

    public Interval interval(String key) {
        return require(key, Interval.class);
    }

    /** Values as configured (after defaults), for reports. */
    public Map<String, Object> snapshot() {
        return snapshot;
    }

    private <T> T require(String key, Class<T> type) {
        T value = optional(key, type);
        if (value == null) throw ConfigurationException.missing(stageName, key);
        return value;
    }

    private <T> T optional(String key, Class<T> type) {
        Object value = values.get(declared(key));
        if (value == null) return null;
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Parameter '" + key + "' of stage '" + stageName + "' is "
                + schema.options().get(key).type() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    private String declared(String key) {
        if (!schema.recognizes(key)) {
            throw new IllegalArgumentException("Stage '" + stageName + "' does not declare parameter '" + key + "'");
        }
        return key;
    }

    @Override
    public String toString() {
        return "StageParameters[" + stageName + "]" + snapshot;
    }
}
