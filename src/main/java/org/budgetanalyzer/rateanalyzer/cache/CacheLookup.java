package org.budgetanalyzer.rateanalyzer.cache;

import java.math.BigDecimal;
import java.util.Objects;

/** Outcome of a {@link RateCache} lookup. */
public sealed interface CacheLookup permits CacheLookup.Hit, CacheLookup.Miss {

  static CacheLookup hit(BigDecimal rate) {
    return new Hit(rate);
  }

  static CacheLookup miss() {
    return Miss.INSTANCE;
  }

  /** The key was present in one of the cache layers. */
  record Hit(BigDecimal rate) implements CacheLookup {
    public Hit {
      Objects.requireNonNull(rate, "rate");
    }
  }

  /** Neither layer holds the key. */
  final class Miss implements CacheLookup {
    private static final Miss INSTANCE = new Miss();

    private Miss() {}

    @Override
    public String toString() {
      return "Miss";
    }
  }
}
