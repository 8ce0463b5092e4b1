package com.rotseproc.qa;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Maps a metric, an optional reference and an ordered {@link BandSet} to a {@link Severity}.
 *
 * <p>The first band whose interval contains the effective value wins. A value that no band
 * contains, including NaN, is graded {@link Severity#mostSevere()}; this class never throws
 * for data reasons.
 */
public final class RangeClassifier {
    private RangeClassifier() {}

    public static Severity classify(double value, OptionalDouble reference, ReferenceMode mode, BandSet bands) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(bands, "bands");

        double effective = reference.isPresent() ? mode.relative(value, reference.getAsDouble()) : value;
        for (ToleranceBand band : bands) {
            if (band.interval().contains(effective)) return band.severity();
        }
        return Severity.mostSevere();
    }

    /** Absolute mode. */
    public static Severity classify(double value, BandSet bands) {
        return classify(value, OptionalDouble.empty(), ReferenceMode.DIFFERENCE, bands);
    }

    /** Collections are reduced by their median before banding. */
    public static Severity classify(Collection<Double> values, OptionalDouble reference, ReferenceMode mode, BandSet bands) {
        return classify(median(values), reference, mode, bands);
    }

    public static Severity classify(Metric metric, OptionalDouble reference, ReferenceMode mode, BandSet bands) {
        return classify(Objects.requireNonNull(metric, "metric").representative(), reference, mode, bands);
    }

    /** Median; the mean of the two middle values for an even count, NaN when empty. */
    public static double median(Collection<Double> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) return Double.NaN;
        double[] sorted = new double[values.size()];
        int i = 0;
        for (Double v : values) sorted[i++] = Objects.requireNonNull(v, "value");
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) return sorted[mid];
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
