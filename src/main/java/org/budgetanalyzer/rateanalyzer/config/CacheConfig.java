package org.budgetanalyzer.rateanalyzer.config;

import java.nio.file.Path;

import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.rateanalyzer.cache.JsonFileRateStore;
import org.budgetanalyzer.rateanalyzer.cache.RateCache;
import org.budgetanalyzer.rateanalyzer.cache.TieredRateCache;

/**
 * Cache configuration for the rate analyzer.
 *
 * <p>Exchange rates are cached in two tiers:
 *
 * <ul>
 *   <li><b>Fast layer:</b> an in-process Spring {@link org.springframework.cache.Cache} named
 *       {@value #EXCHANGE_RATES_CACHE}, backed by a {@link ConcurrentMapCacheManager}. Cleared on
 *       every restart.
 *   <li><b>Durable layer:</b> a JSON file ({@code rate-analyzer.cache.file}) loaded once at
 *       startup and rewritten on every write.
 * </ul>
 *
 * <p>Null values are not cached; a day without a rate is simply absent from both layers.
 *
 * <p><b>Key Structure:</b> {@code {base}_{target}_{yyyy-MM-dd}}, e.g. {@code AUD_NZD_2024-03-10}.
 * The same string is used in the fast layer and as the JSON property name in the durable layer.
 */
@Configuration
public class CacheConfig {

  /** Cache name for daily exchange rates. */
  public static final String EXCHANGE_RATES_CACHE = "exchangeRates";

  @Bean
  public CacheManager cacheManager() {
    var cacheManager = new ConcurrentMapCacheManager(EXCHANGE_RATES_CACHE);
    cacheManager.setAllowNullValues(false);
    return cacheManager;
  }

  @Bean
  public JsonFileRateStore jsonFileRateStore(
      RateAnalyzerProperties properties, ObjectMapper objectMapper) {
    return new JsonFileRateStore(Path.of(properties.getCache().getFile()), objectMapper);
  }

  @Bean
  public RateCache rateCache(CacheManager cacheManager, JsonFileRateStore jsonFileRateStore) {
    return new TieredRateCache(cacheManager.getCache(EXCHANGE_RATES_CACHE), jsonFileRateStore);
  }
}
