package com.rotseproc.qa;

import java.util.Objects;

public record ToleranceBand(Interval interval, Severity severity) {
  public ToleranceBand {
    interval = Objects.requireNonNull(interval, "interval");
    severity = Objects.requireNonNull(severity, "severity");
  }

  public static ToleranceBand of(Interval interval, Severity severity) {
    return new ToleranceBand(interval, severity);
  }
}
