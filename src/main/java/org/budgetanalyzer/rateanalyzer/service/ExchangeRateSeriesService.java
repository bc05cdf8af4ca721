package org.budgetanalyzer.rateanalyzer.service;

import java.time.LocalDate;
import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.rateanalyzer.domain.RatePoint;
import org.budgetanalyzer.rateanalyzer.domain.RateSeries;
import org.budgetanalyzer.rateanalyzer.service.dto.RateResult;

/**
 * Assembles a rate series for a date range, one day at a time.
 *
 * <p>Days are fetched strictly in ascending order and sequentially. A day whose rate is
 * unavailable becomes a gap in the series; it never aborts the rest of the range.
 */
@Service
public class ExchangeRateSeriesService {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateSeriesService.class);

  private final ExchangeRateFetcher exchangeRateFetcher;

  public ExchangeRateSeriesService(ExchangeRateFetcher exchangeRateFetcher) {
    this.exchangeRateFetcher = exchangeRateFetcher;
  }

  /**
   * Fetches the rate for every day from {@code startDate} to {@code endDate}, both inclusive.
   *
   * @param startDate first day
   * @param endDate last day
   * @return the obtained points in ascending date order; empty when no day could be obtained or
   *     when {@code startDate} is after {@code endDate}
   */
  public RateSeries fetchSeries(LocalDate startDate, LocalDate endDate) {
    log.info("Fetching exchange rates from {} to {}", startDate, endDate);

    if (startDate.isAfter(endDate)) {
      log.warn("Start date {} is after end date {}, nothing to fetch", startDate, endDate);
      return RateSeries.empty();
    }

    var points = new ArrayList<RatePoint>();
    var gaps = new ArrayList<LocalDate>();

    for (var date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
      var result = exchangeRateFetcher.fetch(date);

      if (result instanceof RateResult.Available available) {
        points.add(new RatePoint(date, available.rate()));
      } else {
        var unavailable = (RateResult.Unavailable) result;
        log.warn("No rate for {} ({}), leaving a gap", date, unavailable.reason());
        gaps.add(date);
      }
    }

    if (points.isEmpty()) {
      log.warn("No exchange rates fetched.");
      return RateSeries.empty();
    }

    if (!gaps.isEmpty()) {
      log.warn("{} day(s) without a rate: {}", gaps.size(), gaps);
    }

    log.info("Successfully fetched {} of {} days", points.size(), points.size() + gaps.size());
    // already ascending, sorting keeps the invariant independent of the loop above
    return RateSeries.sortedOf(points);
  }
}
