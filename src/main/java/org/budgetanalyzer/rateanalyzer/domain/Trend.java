package org.budgetanalyzer.rateanalyzer.domain;

/** Coarse direction of a rate series, taken from the sign of its regression slope. */
public enum Trend {
  INCREASING("increasing"),
  DECREASING("decreasing"),
  STABLE("stable");

  private final String label;

  Trend(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static Trend fromSlope(double slope) {
    if (slope > 0) {
      return INCREASING;
    }
    if (slope < 0) {
      return DECREASING;
    }
    return STABLE;
  }
}
