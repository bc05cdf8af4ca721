package org.budgetanalyzer.rateanalyzer.cache;

import java.math.BigDecimal;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;

/**
 * {@link RateCache} with a fast in-process layer in front of a durable JSON file.
 *
 * <p><b>Reads:</b> the fast layer is consulted first. On a fast-layer miss the durable layer is
 * consulted and a hit there is copied into the fast layer before being returned.
 *
 * <p><b>Writes:</b> the value goes to the fast layer, then to the durable layer, which persists
 * the whole file before {@link #put} returns. If persisting fails the exception propagates and
 * the run is expected to stop.
 */
public class TieredRateCache implements RateCache {

  private static final Logger log = LoggerFactory.getLogger(TieredRateCache.class);

  private final Cache fastLayer;
  private final JsonFileRateStore durableLayer;

  public TieredRateCache(Cache fastLayer, JsonFileRateStore durableLayer) {
    this.fastLayer = Objects.requireNonNull(fastLayer, "fastLayer");
    this.durableLayer = Objects.requireNonNull(durableLayer, "durableLayer");
  }

  @Override
  public CacheLookup get(CacheKey key) {
    var keyString = key.asString();

    var fastValue = fastLayer.get(keyString, BigDecimal.class);
    if (fastValue != null) {
      log.debug("Memory cache hit for key: {}", keyString);
      return CacheLookup.hit(fastValue);
    }

    var durableValue = durableLayer.get(keyString);
    if (durableValue.isPresent()) {
      log.debug("File cache hit for key: {}", keyString);
      fastLayer.put(keyString, durableValue.get());
      return CacheLookup.hit(durableValue.get());
    }

    return CacheLookup.miss();
  }

  @Override
  public void put(CacheKey key, BigDecimal rate) {
    Objects.requireNonNull(rate, "rate");
    var keyString = key.asString();

    fastLayer.put(keyString, rate);
    durableLayer.put(keyString, rate);

    log.debug("Rate for key: {} has been updated in both memory and file cache", keyString);
  }
}
