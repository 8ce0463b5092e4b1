package com.rotseproc.qa;

import java.util.Objects;

/**
 * Outcome of classifying a metric. Declaration order is the severity order:
 * {@code NORMAL < WARNING < ALERT}.
 */
public enum Severity {
    NORMAL(0),
    WARNING(1),
    ALERT(2);

    private final int exitCode;

    Severity(int exitCode) {
        this.exitCode = exitCode;
    }

    /** Process exit code used when this is the worst status of a run. */
    public int exitCode() {
        return exitCode;
    }

    public boolean isWorseThan(Severity other) {
        return compareTo(Objects.requireNonNull(other, "other")) > 0;
    }

    public static Severity worst(Severity a, Severity b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Worst-of aggregation; an empty input is {@link #NORMAL}. */
    public static Severity worstOf(Iterable<Severity> severities) {
        Severity out = NORMAL;
        for (Severity s : severities) out = worst(out, s);
        return out;
    }

    /** The most severe outcome the system defines. */
    public static Severity mostSevere() {
        Severity[] all = values();
        return all[all.length - 1];
    }
}
