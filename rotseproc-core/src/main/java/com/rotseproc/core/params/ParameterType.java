package com.rotseproc.core.params;

public enum ParameterType {
    NUMBER,
    INTEGER,
    TEXT,
    PATH,
    /** {@code [lo, hi]} (closed) or {@code {"min":..,"max":..,"minInclusive":..,"maxInclusive":..}} */
    INTERVAL
}
