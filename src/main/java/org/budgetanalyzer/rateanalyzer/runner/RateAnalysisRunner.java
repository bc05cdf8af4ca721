package org.budgetanalyzer.rateanalyzer.runner;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.rateanalyzer.cache.CachePersistenceException;
import org.budgetanalyzer.rateanalyzer.config.RateAnalyzerProperties;
import org.budgetanalyzer.rateanalyzer.report.RateAnalysisSink;
import org.budgetanalyzer.rateanalyzer.service.ExchangeRateSeriesService;
import org.budgetanalyzer.rateanalyzer.service.RateStatisticsService;
import org.budgetanalyzer.rateanalyzer.service.SeriesNormalizer;
import org.budgetanalyzer.rateanalyzer.service.dto.RateStatistics;

/**
 * Runs one analysis when the application is ready: fetch, normalize, analyze, then hand the
 * results to every {@link RateAnalysisSink}.
 *
 * <p>A range without a single obtainable rate ends the run normally with a "no data" warning. A
 * cache persistence failure stops the application.
 */
@Component
public class RateAnalysisRunner {

  private static final Logger log = LoggerFactory.getLogger(RateAnalysisRunner.class);

  private final RateAnalyzerProperties properties;
  private final ExchangeRateSeriesService exchangeRateSeriesService;
  private final SeriesNormalizer seriesNormalizer;
  private final RateStatisticsService rateStatisticsService;
  private final List<RateAnalysisSink> sinks;
  private final Clock clock;

  public RateAnalysisRunner(
      RateAnalyzerProperties properties,
      ExchangeRateSeriesService exchangeRateSeriesService,
      SeriesNormalizer seriesNormalizer,
      RateStatisticsService rateStatisticsService,
      List<RateAnalysisSink> sinks,
      Clock clock) {
    this.properties = properties;
    this.exchangeRateSeriesService = exchangeRateSeriesService;
    this.seriesNormalizer = seriesNormalizer;
    this.rateStatisticsService = rateStatisticsService;
    this.sinks = sinks;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    logConfiguration();

    if (!properties.getAnalysis().isRunOnStartup()) {
      log.info("Startup analysis is disabled");
      return;
    }

    var endDate = resolveEndDate();
    var startDate = resolveStartDate(endDate);

    try {
      run(startDate, endDate);
    } catch (CachePersistenceException e) {
      log.error("CRITICAL: exchange rate cache could not be persisted, aborting run", e);
      throw new IllegalStateException(
          "Cannot guarantee cache durability, run aborted: " + e.getMessage(), e);
    }
  }

  /**
   * Runs the pipeline for an inclusive date range.
   *
   * @param startDate first day
   * @param endDate last day
   * @return the statistics, empty when no rate could be obtained for any day
   */
  public Optional<RateStatistics> run(LocalDate startDate, LocalDate endDate) {
    var pair = properties.getBaseCurrency() + "/" + properties.getTargetCurrency();
    log.info("Fetching {} exchange rates from {} to {}", pair, startDate, endDate);

    var series = exchangeRateSeriesService.fetchSeries(startDate, endDate);
    if (series.isEmpty()) {
      log.warn(
          "No data: no {} exchange rate obtainable between {} and {}", pair, startDate, endDate);
      return Optional.empty();
    }

    log.info("Preprocessing the fetched data");
    var normalized = seriesNormalizer.normalize(series);

    log.info("Analyzing the preprocessed data");
    var statistics = rateStatisticsService.analyze(normalized);
    log.info("Standard Deviation of Exchange Rates: {}", format(statistics.standardDeviation()));
    log.info("Range of Exchange Rates: {}", format(statistics.range()));
    log.info("Highest exchange rate observed on: {}", statistics.best().date());
    log.info("Lowest exchange rate observed on: {}", statistics.worst().date());

    for (var sink : sinks) {
      sink.accept(normalized, statistics);
    }

    log.info("Data analysis completed successfully");
    return Optional.of(statistics);
  }

  private LocalDate resolveEndDate() {
    var configured = properties.getAnalysis().getEndDate();
    return configured != null ? configured : LocalDate.now(clock);
  }

  private LocalDate resolveStartDate(LocalDate endDate) {
    var configured = properties.getAnalysis().getStartDate();
    return configured != null
        ? configured
        : endDate.minusDays(properties.getAnalysis().getLookbackDays());
  }

  private void logConfiguration() {
    var provider = properties.getProvider();
    var retry = properties.getRetry();
    log.info(
        "Rate Analyzer Configuration: pair={}/{}, baseUrl={}, accessKey={}, maxAttempts={},"
            + " initialBackoff={}, cacheFile={}, rollingWindow={}",
        properties.getBaseCurrency(),
        properties.getTargetCurrency(),
        provider.getBaseUrl(),
        mask(provider.getAccessKey()),
        retry.getMaxAttempts(),
        retry.getInitialBackoff(),
        properties.getCache().getFile(),
        properties.getAnalysis().getRollingWindow());
  }

  private static String mask(String secret) {
    if (secret == null || secret.length() <= 4) {
      return "****";
    }
    return "****" + secret.substring(secret.length() - 4);
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }
}
