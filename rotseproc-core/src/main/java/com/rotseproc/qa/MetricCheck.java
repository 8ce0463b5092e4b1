package com.rotseproc.qa;

import java.util.Objects;

/**
 * Declares how one metric of a monitoring stage is graded: which parameters hold its static
 * reference and its normal/warning ranges, and how the reference is applied.
 *
 * @param metric         metric name; also the key looked up in the run's reference metrics
 * @param referenceKey   parameter holding the configured reference, or null when none is declared
 * @param normalRangeKey parameter holding the normal interval
 * @param warnRangeKey   parameter holding the warning interval
 * @param mode           reference-relative operator
 */
public record MetricCheck(
    String metric,
    String referenceKey,
    String normalRangeKey,
    String warnRangeKey,
    ReferenceMode mode
) {
  public MetricCheck {
    metric = Objects.requireNonNull(metric, "metric");
    normalRangeKey = Objects.requireNonNull(normalRangeKey, "normalRangeKey");
    warnRangeKey = Objects.requireNonNull(warnRangeKey, "warnRangeKey");
    mode = Objects.requireNonNull(mode, "mode");
  }

  /** Keys named {@code <METRIC>_REF}, {@code <METRIC>_NORMAL_RANGE}, {@code <METRIC>_WARN_RANGE}. */
  public static MetricCheck conventional(String metric, ReferenceMode mode) {
    return new MetricCheck(metric, metric + "_REF", metric + "_NORMAL_RANGE", metric + "_WARN_RANGE", mode);
  }

  public MetricCheck withMode(ReferenceMode newMode) {
    return new MetricCheck(metric, referenceKey, normalRangeKey, warnRangeKey, newMode);
  }
}
