package com.rotseproc.qa;

import java.util.List;
import java.util.Objects;

/**
 * A named scalar, or an ordered collection of per-item values (one per image, say).
 */
public record Metric(String name, List<Double> values, boolean vector) {
  public Metric {
    name = Objects.requireNonNull(name, "name");
    values = List.copyOf(Objects.requireNonNull(values, "values"));
    if (!vector && values.size() != 1) throw new IllegalArgumentException("scalar metric needs exactly one value: " + name);
  }

  public static Metric scalar(String name, double value) {
    return new Metric(name, List.of(value), false);
  }

  public static Metric vector(String name, List<Double> values) {
    return new Metric(name, values, true);
  }

  /** The value used for banding: the scalar itself, or the median of a collection. */
  public double representative() {
    return vector ? RangeClassifier.median(values) : values.get(0);
  }

  /** Serialization-agnostic rendering used in reports. */
  public String asText() {
    return vector ? values.toString() : Double.toString(values.get(0));
  }
}
