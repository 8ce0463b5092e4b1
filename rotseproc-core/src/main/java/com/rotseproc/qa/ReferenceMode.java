package com.rotseproc.qa;

import java.util.Locale;

/** How a metric is expressed relative to its reference before banding. */
public enum ReferenceMode {
    DIFFERENCE {
        @Override
        public double relative(double value, double reference) {
            return value - reference;
        }
    },
    RATIO {
        @Override
        public double relative(double value, double reference) {
            // 0/0 and x/0 fall outside every finite band
            if (reference == 0.0) return Double.NaN;
            return value / reference;
        }
    };

    public abstract double relative(double value, double reference);

    public static ReferenceMode parse(String raw) {
        String key = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "difference", "diff", "subtract" -> DIFFERENCE;
            case "ratio", "divide" -> RATIO;
            default -> throw new IllegalArgumentException("Unsupported reference mode: " + raw);
        };
    }
}
