package org.budgetanalyzer.rateanalyzer.cache;

import java.time.LocalDate;
import java.util.Currency;
import java.util.Objects;

/**
 * Composite key identifying one cached rate.
 *
 * <p>String form is {@code {base}_{target}_{yyyy-MM-dd}}, e.g. {@code AUD_NZD_2024-03-10}. This is
 * the property name used in the durable JSON file, so changing it orphans existing cache files.
 */
public record CacheKey(Currency baseCurrency, Currency targetCurrency, LocalDate date) {

  private static final char SEPARATOR = '_';

  public CacheKey {
    Objects.requireNonNull(baseCurrency, "baseCurrency");
    Objects.requireNonNull(targetCurrency, "targetCurrency");
    Objects.requireNonNull(date, "date");
  }

  public String asString() {
    return baseCurrency.getCurrencyCode()
        + SEPARATOR
        + targetCurrency.getCurrencyCode()
        + SEPARATOR
        + date;
  }

  @Override
  public String toString() {
    return asString();
  }
}
