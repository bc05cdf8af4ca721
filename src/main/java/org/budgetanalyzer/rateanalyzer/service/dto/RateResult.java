package org.budgetanalyzer.rateanalyzer.service.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Outcome of fetching the rate for one day. */
public sealed interface RateResult permits RateResult.Available, RateResult.Unavailable {

  LocalDate date();

  /**
   * A rate was obtained.
   *
   * @param date the requested day
   * @param rate the rate
   * @param source where the rate came from
   */
  record Available(LocalDate date, BigDecimal rate, RateSource source) implements RateResult {
    public Available {
      Objects.requireNonNull(date, "date");
      Objects.requireNonNull(rate, "rate");
      Objects.requireNonNull(source, "source");
    }
  }

  /**
   * No rate could be obtained for the day.
   *
   * @param date the requested day
   * @param reason why the rate is missing
   * @param detail human readable description of the last failure
   */
  record Unavailable(LocalDate date, UnavailableReason reason, String detail)
      implements RateResult {
    public Unavailable {
      Objects.requireNonNull(date, "date");
      Objects.requireNonNull(reason, "reason");
    }
  }
}
