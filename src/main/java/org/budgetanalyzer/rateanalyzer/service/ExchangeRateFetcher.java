package org.budgetanalyzer.rateanalyzer.service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Currency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.rateanalyzer.cache.CacheKey;
import org.budgetanalyzer.rateanalyzer.cache.CacheLookup;
import org.budgetanalyzer.rateanalyzer.cache.RateCache;
import org.budgetanalyzer.rateanalyzer.client.exchangerates.ExchangeRatesApiClient;
import org.budgetanalyzer.rateanalyzer.client.exchangerates.ProviderResponse;
import org.budgetanalyzer.rateanalyzer.config.RateAnalyzerProperties;
import org.budgetanalyzer.rateanalyzer.exception.ClientException;
import org.budgetanalyzer.rateanalyzer.service.dto.RateResult;
import org.budgetanalyzer.rateanalyzer.service.dto.RateSource;
import org.budgetanalyzer.rateanalyzer.service.dto.UnavailableReason;
import org.budgetanalyzer.rateanalyzer.support.Sleeper;

/**
 * Obtains the rate of the configured currency pair for a single day.
 *
 * <p><b>Algorithm:</b>
 *
 * <ol>
 *   <li>Look the day up in the {@link RateCache}. A hit is returned immediately, no network call
 *       is made.
 *   <li>On a miss, call the provider up to {@code rate-analyzer.retry.max-attempts} times:
 *       <ul>
 *         <li>{@link ProviderResponse.TransientFailure}: wait {@code initial-backoff * 2^n} before
 *             attempt {@code n} (n counted from 0) and try again, or give up with {@link
 *             UnavailableReason#RETRIES_EXHAUSTED} when no attempts remain
 *         <li>{@link ProviderResponse.ProviderFailure}, or a {@link ClientException} from the
 *             client: give up at once with {@link UnavailableReason#PROVIDER_ERROR}
 *         <li>{@link ProviderResponse.InvalidData}: give up at once with {@link
 *             UnavailableReason#MISSING_RATE}
 *         <li>{@link ProviderResponse.Rates} without a positive rate for the target currency:
 *             give up at once with {@link UnavailableReason#MISSING_RATE}
 *         <li>{@link ProviderResponse.Rates} with a rate: write it through the cache and return it
 *       </ul>
 * </ol>
 *
 * <p>A {@link org.budgetanalyzer.rateanalyzer.cache.CachePersistenceException} raised by the write
 * through is not converted into a result; it propagates to the caller.
 */
@Service
public class ExchangeRateFetcher {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateFetcher.class);

  private final ExchangeRatesApiClient exchangeRatesApiClient;
  private final RateCache rateCache;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;
  private final Currency baseCurrency;
  private final Currency targetCurrency;
  private final int maxAttempts;
  private final Duration initialBackoff;

  public ExchangeRateFetcher(
      ExchangeRatesApiClient exchangeRatesApiClient,
      RateCache rateCache,
      RateAnalyzerProperties properties,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.exchangeRatesApiClient = exchangeRatesApiClient;
    this.rateCache = rateCache;
    this.sleeper = sleeper;
    this.meterRegistry = meterRegistry;
    this.baseCurrency = Currency.getInstance(properties.getBaseCurrency());
    this.targetCurrency = Currency.getInstance(properties.getTargetCurrency());
    this.maxAttempts = properties.getRetry().getMaxAttempts();
    this.initialBackoff = properties.getRetry().getInitialBackoff();
  }

  /**
   * Returns the rate for one day, from the cache or the provider.
   *
   * @param date the day
   * @return {@link RateResult.Available} or {@link RateResult.Unavailable}
   */
  public RateResult fetch(LocalDate date) {
    var key = new CacheKey(baseCurrency, targetCurrency, date);

    if (rateCache.get(key) instanceof CacheLookup.Hit hit) {
      log.info("Using cached data for {}", date);
      recordCacheLookup("hit");
      return new RateResult.Available(date, hit.rate(), RateSource.CACHE);
    }

    log.info("Cache miss for {}. Fetching fresh data.", date);
    recordCacheLookup("miss");
    return fetchFromProvider(key);
  }

  private RateResult fetchFromProvider(CacheKey key) {
    var date = key.date();
    String lastFailure = null;

    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      if (attempt > 0) {
        var delay = backoffBefore(attempt);
        log.info(
            "Retrying {} in {} ms (attempt {}/{})",
            date,
            delay.toMillis(),
            attempt + 1,
            maxAttempts);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return unavailable(date, UnavailableReason.INTERRUPTED, "Interrupted while backing off");
        }
      }

      ProviderResponse response;
      try {
        response =
            exchangeRatesApiClient.getHistoricalRates(
                date, baseCurrency.getCurrencyCode(), targetCurrency.getCurrencyCode());
      } catch (ClientException e) {
        recordAttempt("client_error");
        return unavailable(date, UnavailableReason.PROVIDER_ERROR, describe(e));
      }

      if (response instanceof ProviderResponse.Rates rates) {
        recordAttempt("success");
        return acceptRates(key, rates);
      }

      if (response instanceof ProviderResponse.ProviderFailure failure) {
        recordAttempt("provider_error");
        return unavailable(
            date,
            UnavailableReason.PROVIDER_ERROR,
            "HTTP " + failure.statusCode() + ": " + failure.message());
      }

      if (response instanceof ProviderResponse.InvalidData invalidData) {
        recordAttempt("invalid_data");
        return unavailable(date, UnavailableReason.MISSING_RATE, invalidData.message());
      }

      var transientFailure = (ProviderResponse.TransientFailure) response;
      recordAttempt("transient_error");
      lastFailure = transientFailure.message();
      log.warn(
          "Request failed for {}, attempt {}/{}: {}", date, attempt + 1, maxAttempts, lastFailure);
    }

    return unavailable(
        date,
        UnavailableReason.RETRIES_EXHAUSTED,
        "Gave up after " + maxAttempts + " attempts, last failure: " + lastFailure);
  }

  private RateResult acceptRates(CacheKey key, ProviderResponse.Rates rates) {
    var currencyCode = targetCurrency.getCurrencyCode();
    var rate = rates.body().findRate(currencyCode);

    if (rate.isEmpty()) {
      return unavailable(
          key.date(),
          UnavailableReason.MISSING_RATE,
          "Rate for '" + currencyCode + "' not found in provider response");
    }

    BigDecimal value = rate.get();
    if (value.signum() <= 0) {
      return unavailable(
          key.date(),
          UnavailableReason.MISSING_RATE,
          "Rate for '" + currencyCode + "' is not positive: " + value);
    }

    rateCache.put(key, value);
    return new RateResult.Available(key.date(), value, RateSource.PROVIDER);
  }

  private static String describe(ClientException e) {
    return e.getCause() != null ? e.getMessage() + ": " + e.getCause() : e.getMessage();
  }

  private Duration backoffBefore(int attempt) {
    return initialBackoff.multipliedBy(1L << attempt);
  }

  private RateResult unavailable(LocalDate date, UnavailableReason reason, String detail) {
    log.error("Failed to fetch rate for {}: {} - {}", date, reason, detail);
    meterRegistry.counter("exchange.rate.fetch.unavailable", "reason", reason.name()).increment();
    return new RateResult.Unavailable(date, reason, detail);
  }

  private void recordCacheLookup(String result) {
    meterRegistry.counter("exchange.rate.fetch.cache", "result", result).increment();
  }

  private void recordAttempt(String outcome) {
    meterRegistry.counter("exchange.rate.fetch.attempts", "outcome", outcome).increment();
  }
}
