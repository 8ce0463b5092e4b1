package com.rotseproc.qa;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered acceptance tiers. Evaluation walks the bands in declaration order and the first band
 * containing the value decides, so narrower (less permissive) bands are declared first.
 */
public final class BandSet implements Iterable<ToleranceBand> {
    private final List<ToleranceBand> bands;

    private BandSet(List<ToleranceBand> bands) {
        if (bands.isEmpty()) throw new IllegalArgumentException("band set must not be empty");
        this.bands = List.copyOf(bands);
    }

    public static BandSet of(List<ToleranceBand> bands) {
        return new BandSet(Objects.requireNonNull(bands, "bands"));
    }

    public static BandSet of(ToleranceBand... bands) {
        return new BandSet(List.of(bands));
    }

    /** Normal band first, then the wider warning band around it. */
    public static BandSet nested(Interval normal, Interval warn) {
        return of(ToleranceBand.of(normal, Severity.NORMAL), ToleranceBand.of(warn, Severity.WARNING));
    }

    public List<ToleranceBand> bands() {
        return bands;
    }

    public int size() {
        return bands.size();
    }

    @Override
    public Iterator<ToleranceBand> iterator() {
        return bands.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BandSet other && bands.equals(other.bands);
    }

    @Override
    public int hashCode() {
        return bands.hashCode();
    }

    @Override
    public String toString() {
        return "BandSet" + bands;
    }
}
