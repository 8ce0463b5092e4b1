package com.rotseproc.core.params;

import com.rotseproc.core.exception.ConfigurationException;
import com.rotseproc.qa.Interval;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every parameter a stage recognizes, with its type and whether it is required. Validation is
 * strict: unknown keys are rejected, required keys must be present, and nothing is coerced
 * across types except integral numbers into text (night identifiers are often written bare).
 */
public final class ParameterSchema {
    private static final ParameterSchema EMPTY = new ParameterSchema(Map.of());

    private final Map<String, Option> options;

    private ParameterSchema(Map<String, Option> options) {
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ParameterSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public record Option(String key, ParameterType type, boolean required, Object defaultValue) {
      public Option {
        key = Objects.requireNonNull(key, "key");
        type = Objects.requireNonNull(type, "type");
      }
    }

    public static final class Builder {
        private final Map<String, Option> options = new LinkedHashMap<>();

        private Builder() {}

        public Builder required(String key, ParameterType type) {
            return add(new Option(key, type, true, null));
        }

        public Builder optional(String key, ParameterType type) {
            return add(new Option(key, type, false, null));
        }

        public Builder optional(String key, ParameterType type, Object defaultValue) {
            return add(new Option(key, type, false, Objects.requireNonNull(defaultValue, "defaultValue")));
        }

        /** Adds every option of another schema; used by stage subclasses extending a base schema. */
        public Builder include(ParameterSchema other) {
            for (Option o : other.options.values()) add(o);
            return this;
        }

        private Builder add(Option option) {
            if (options.putIfAbsent(option.key(), option) != null) {
                throw new IllegalArgumentException("Duplicate parameter: " + option.key());
            }
            return this;
        }

        public ParameterSchema build() {
            return new ParameterSchema(options);
        }
    }

    public Map<String, Option> options() {
        return options;
    }

    public boolean recognizes(String key) {
        return options.containsKey(key);
    }

    public StageParameters validate(String stageName, Map<String, ?> raw) {
        Objects.requireNonNull(stageName, "stageName");
        Map<String, ?> block = raw == null ? Map.of() : raw;

        for (String key : block.keySet()) {
            if (!options.containsKey(key)) throw ConfigurationException.unrecognized(stageName, key);
        }

        Map<String, Object> typed = new LinkedHashMap<>();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (Option option : options.values()) {
            Object value = block.get(option.key());
            if (value == null) {
                if (option.required()) throw ConfigurationException.missing(stageName, option.key());
                value = option.defaultValue();
                if (value == null) continue;
            }
            typed.put(option.key(), coerce(stageName, option, value));
            snapshot.put(option.key(), value);
        }
        return new StageParameters(stageName, this, typed, snapshot);
    }

    private static Object coerce(String stageName, Option option, Object value) {
        String key = option.key();
        switch (option.type()) {
            case NUMBER:
                if (value instanceof Number n) return n.doubleValue();
                throw ConfigurationException.invalid(stageName, key, "expected a number, got " + describe(value));
            case INTEGER:
                if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return n.longValue();
                throw ConfigurationException.invalid(stageName, key, "expected an integer, got " + describe(value));
            case TEXT:
                if (value instanceof CharSequence s) return s.toString();
                if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return Long.toString(n.longValue());
                throw ConfigurationException.invalid(stageName, key, "expected text, got " + describe(value));
            case PATH:
                if (value instanceof Path p) return p;
                if (value instanceof CharSequence s && s.length() > 0) return Path.of(s.toString());
                throw ConfigurationException.invalid(stageName, key, "expected a path, got " + describe(value));
            case INTERVAL:
                return interval(stageName, key, value);
            default:
                throw new IllegalStateException("Unhandled parameter type " + option.type());
        }
    }

    private static Interval interval(String stageName, String key, Object value) {
        try {
            if (value instanceof Interval i) return i;
            if (value instanceof List<?> bounds) {
                if (bounds.size() != 2 || !(bounds.get(0) instanceof Number lo) || !(bounds.get(1) instanceof Number hi)) {
                    throw ConfigurationException.invalid(stageName, key, "expected [lower, upper], got " + value);
                }
                return Interval.closed(lo.doubleValue(), hi.doubleValue());
            }
            if (value instanceof Map<?, ?> m) {
                if (!(m.get("min") instanceof Number lo) || !(m.get("max") instanceof Number hi)) {
                    throw ConfigurationException.invalid(stageName, key, "interval object needs numeric min and max, got " + value);
                }
                return new Interval(lo.doubleValue(), hi.doubleValue(), flag(stageName, key, m, "minInclusive"), flag(stageName, key, m, "maxInclusive"));
            }
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.invalid(stageName, key, e.getMessage());
        }
        throw ConfigurationException.invalid(stageName, key, "expected an interval, got " + describe(value));
    }

    /** Bounds are inclusive unless the flag is given as a JSON boolean false. */
    private static boolean flag(String stageName, String key, Map<?, ?> interval, String name) {
        Object o = interval.get(name);
        if (o == null) return true;
        if (o instanceof Boolean b) return b;
        throw ConfigurationException.invalid(stageName, key, name + " must be true or false, got " + describe(o));
    }

    private static String describe(Object value) {
        return value.getClass().getSimpleName() + " " + value;
    }
}
