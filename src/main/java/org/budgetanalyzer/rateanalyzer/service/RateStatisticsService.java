package org.budgetanalyzer.rateanalyzer.service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.rateanalyzer.config.RateAnalyzerProperties;
import org.budgetanalyzer.rateanalyzer.domain.RatePoint;
import org.budgetanalyzer.rateanalyzer.domain.RateSeries;
import org.budgetanalyzer.rateanalyzer.domain.Trend;
import org.budgetanalyzer.rateanalyzer.exception.BusinessException;
import org.budgetanalyzer.rateanalyzer.exception.RateAnalyzerError;
import org.budgetanalyzer.rateanalyzer.service.dto.RateStatistics;
import org.budgetanalyzer.rateanalyzer.service.dto.RollingWindowPoint;

/**
 * Computes descriptive statistics over a normalized rate series.
 *
 * <p>Standard deviations are sample standard deviations (divided by n - 1). Rolling statistics use
 * a trailing window of {@code rate-analyzer.analysis.rolling-window} days that ends on, and
 * includes, the day it is reported for.
 *
 * <p>The trend is the sign of an ordinary least squares fit of rate against the epoch second at
 * the start of each day in UTC.
 */
@Service
public class RateStatisticsService {

  private static final Logger log = LoggerFactory.getLogger(RateStatisticsService.class);

  private final int rollingWindow;

  public RateStatisticsService(RateAnalyzerProperties properties) {
    this.rollingWindow = properties.getAnalysis().getRollingWindow();
  }

  /**
   * Analyzes a series.
   *
   * @param series a non-empty series, normally the output of {@link SeriesNormalizer}
   * @return the statistics
   * @throws BusinessException with code {@link RateAnalyzerError#EMPTY_SERIES} if the series is
   *     empty
   */
  public RateStatistics analyze(RateSeries series) {
    if (series.isEmpty()) {
      throw new BusinessException(
          "Cannot analyze an empty rate series", RateAnalyzerError.EMPTY_SERIES.name());
    }

    log.info("Starting data analysis of {}", series);

    if (series.size() < rollingWindow) {
      log.warn(
          "Series has {} points, fewer than the {}-day rolling window; no rolling statistics",
          series.size(),
          rollingWindow);
    }

    var rates = series.rates();
    var best = findBest(series);
    var worst = findWorst(series);
    var mean = new Mean().evaluate(rates);
    var standardDeviation = new StandardDeviation().evaluate(rates);
    var range = best.rate().subtract(worst.rate()).doubleValue();

    var rollingMean = rollingMean(series, rates);
    var rollingStandardDeviation = rollingStandardDeviation(series, rates);
    var volatilityPeak = findPeak(rollingStandardDeviation);

    var regression = regress(series);
    var slope = regression[0];
    var intercept = regression[1];
    var trend = Trend.fromSlope(slope);

    log.info("The overall trend in the exchange rate is {}", trend.getLabel());
    if (volatilityPeak != null) {
      log.info("Date with highest volatility observed on: {}", volatilityPeak.date());
    }

    return new RateStatistics(
        best,
        worst,
        mean,
        standardDeviation,
        range,
        rollingWindow,
        rollingMean,
        rollingStandardDeviation,
        volatilityPeak,
        trend,
        slope,
        intercept);
  }

  /** Epoch second used as the regression x value for a day. */
  public static long timestampOf(LocalDate date) {
    return date.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
  }

  private static RatePoint findBest(RateSeries series) {
    var best = series.first();
    for (var point : series) {
      // strictly greater keeps the earliest date on ties
      if (point.rate().compareTo(best.rate()) > 0) {
        best = point;
      }
    }
    return best;
  }

  private static RatePoint findWorst(RateSeries series) {
    var worst = series.first();
    for (var point : series) {
      if (point.rate().compareTo(worst.rate()) < 0) {
        worst = point;
      }
    }
    return worst;
  }

  private List<RollingWindowPoint> rollingMean(RateSeries series, double[] rates) {
    var mean = new Mean();
    var rv = new ArrayList<RollingWindowPoint>();
    for (int end = rollingWindow - 1; end < rates.length; end++) {
      var value = mean.evaluate(rates, end - rollingWindow + 1, rollingWindow);
      rv.add(new RollingWindowPoint(series.get(end).date(), value));
    }
    return rv;
  }

  private List<RollingWindowPoint> rollingStandardDeviation(RateSeries series, double[] rates) {
    var standardDeviation = new StandardDeviation();
    var rv = new ArrayList<RollingWindowPoint>();
    for (int end = rollingWindow - 1; end < rates.length; end++) {
      var value = standardDeviation.evaluate(rates, end - rollingWindow + 1, rollingWindow);
      rv.add(new RollingWindowPoint(series.get(end).date(), value));
    }
    return rv;
  }

  private static RollingWindowPoint findPeak(List<RollingWindowPoint> points) {
    RollingWindowPoint peak = null;
    for (var point : points) {
      if (peak == null || point.value() > peak.value()) {
        peak = point;
      }
    }
    return peak;
  }

  /** Returns {slope, intercept}. */
  private static double[] regress(RateSeries series) {
    if (series.size() < 2) {
      // a single point has no direction
      return new double[] {0.0, series.first().rate().doubleValue()};
    }

    var regression = new SimpleRegression();
    for (var point : series) {
      regression.addData(timestampOf(point.date()), point.rate().doubleValue());
    }

    var slope = regression.getSlope();
    // collapse -0.0 so a flat series reports a plain zero slope
    return new double[] {slope == 0.0 ? 0.0 : slope, regression.getIntercept()};
  }
}
