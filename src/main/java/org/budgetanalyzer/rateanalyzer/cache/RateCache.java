package org.budgetanalyzer.rateanalyzer.cache;

import java.math.BigDecimal;

/** Day-keyed store of exchange rates. Implementations never touch the network. */
public interface RateCache {

  /**
   * Looks up the rate stored for a key.
   *
   * @param key the key to look up
   * @return {@link CacheLookup.Hit} with the rate, or {@link CacheLookup.Miss}
   */
  CacheLookup get(CacheKey key);

  /**
   * Stores a rate, replacing any previous value for the key.
   *
   * @param key the key
   * @param rate the rate to store
   * @throws CachePersistenceException if the rate cannot be made durable
   */
  void put(CacheKey key, BigDecimal rate);
}
