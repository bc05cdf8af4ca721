package org.budgetanalyzer.rateanalyzer.service.dto;

import java.util.List;
import java.util.Optional;

import org.budgetanalyzer.rateanalyzer.domain.RatePoint;
import org.budgetanalyzer.rateanalyzer.domain.Trend;

/**
 * Descriptive statistics of a normalized rate series.
 *
 * <p>Rolling series only contain days that close a full window, so they are shorter than the
 * analyzed series by {@code rollingWindow - 1} days and empty when the series is shorter than the
 * window.
 *
 * @param best highest rate, earliest date on ties
 * @param worst lowest rate, earliest date on ties
 * @param mean arithmetic mean of all rates
 * @param standardDeviation sample standard deviation of all rates
 * @param range highest rate minus lowest rate
 * @param rollingWindow size of the trailing window in days
 * @param rollingMean trailing mean per day
 * @param rollingStandardDeviation trailing sample standard deviation per day
 * @param volatilityPeak day with the highest rolling standard deviation, null when no window is
 *     complete
 * @param trend direction taken from the regression slope
 * @param slope regression slope, in rate per second
 * @param intercept regression intercept at epoch second zero
 */
public record RateStatistics(
    RatePoint best,
    RatePoint worst,
    double mean,
    double standardDeviation,
    double range,
    int rollingWindow,
    List<RollingWindowPoint> rollingMean,
    List<RollingWindowPoint> rollingStandardDeviation,
    RollingWindowPoint volatilityPeak,
    Trend trend,
    double slope,
    double intercept) {

  public RateStatistics {
    rollingMean = List.copyOf(rollingMean);
    rollingStandardDeviation = List.copyOf(rollingStandardDeviation);
  }

  public Optional<RollingWindowPoint> findVolatilityPeak() {
    return Optional.ofNullable(volatilityPeak);
  }

  /**
   * Evaluates the regression line at an epoch second, for drawing the trend line.
   *
   * @param epochSecond x coordinate
   * @return fitted rate
   */
  public double trendValueAt(long epochSecond) {
    return slope * epochSecond + intercept;
  }
}
