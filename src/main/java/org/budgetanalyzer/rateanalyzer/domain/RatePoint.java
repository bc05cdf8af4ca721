package org.budgetanalyzer.rateanalyzer.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Exchange rate observed for a single calendar day.
 *
 * @param date the day the rate applies to
 * @param rate the conversion rate, always positive
 */
public record RatePoint(LocalDate date, BigDecimal rate) {

  public RatePoint {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(rate, "rate");
    if (rate.signum() <= 0) {
      throw new IllegalArgumentException("Rate must be positive, got " + rate + " on " + date);
    }
  }

  /** Returns a point for {@code date} carrying this point's rate. */
  public RatePoint withDate(LocalDate date) {
    return new RatePoint(date, rate);
  }
}
