package com.rotseproc.qa;

public record Interval(
    double lower,
    double upper,
    boolean lowerInclusive,
    boolean upperInclusive
) {
  public Interval {
    if (Double.isNaN(lower) || Double.isNaN(upper)) throw new IllegalArgumentException("interval bounds must not be NaN");
    if (lower > upper) throw new IllegalArgumentException("interval lower bound " + lower + " exceeds upper bound " + upper);
  }

  /** {@code [lower, upper]} */
  public static Interval closed(double lower, double upper) {
    return new Interval(lower, upper, true, true);
  }

  /** {@code [lower, upper)} */
  public static Interval halfOpen(double lower, double upper) {
    return new Interval(lower, upper, true, false);
  }

  /** NaN is never contained. */
  public boolean contains(double value) {
    if (Double.isNaN(value)) return false;
    boolean aboveLower = lowerInclusive ? value >= lower : value > lower;
    boolean belowUpper = upperInclusive ? value <= upper : value < upper;
    return aboveLower && belowUpper;
  }

  @Override
  public String toString() {
    return (lowerInclusive ? "[" : "(") + lower + ", " + upper + (upperInclusive ? "]" : ")");
  }
}
