package org.budgetanalyzer.rateanalyzer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import org.budgetanalyzer.rateanalyzer.config.RateAnalyzerProperties;
import org.budgetanalyzer.rateanalyzer.domain.RatePoint;
import org.budgetanalyzer.rateanalyzer.domain.RateSeries;
import org.budgetanalyzer.rateanalyzer.domain.Trend;
import org.budgetanalyzer.rateanalyzer.exception.BusinessException;
import org.budgetanalyzer.rateanalyzer.service.dto.RollingWindowPoint;

class RateStatisticsServiceTest {

  private static final LocalDate START = LocalDate.of(2024, 3, 1);

  private RateStatisticsService rateStatisticsService;

  @BeforeEach
  void setUp() {
    rateStatisticsService = new RateStatisticsService(new RateAnalyzerProperties());
  }

  // ===========================================================================================
  // Trend
  // ===========================================================================================

  @Test
  @DisplayName("Strictly increasing series should have a positive slope")
  void increasingSeriesHasPositiveSlope() {
    var statistics = rateStatisticsService.analyze(series("1.01", "1.02", "1.04", "1.07", "1.08"));

    assertThat(statistics.slope()).isPositive();
    assertThat(statistics.trend()).isEqualTo(Trend.INCREASING);
  }

  @Test
  @DisplayName("Strictly decreasing series should have a negative slope")
  void decreasingSeriesHasNegativeSlope() {
    var statistics = rateStatisticsService.analyze(series("1.09", "1.08", "1.05", "1.01"));

    assertThat(statistics.slope()).isNegative();
    assertThat(statistics.trend()).isEqualTo(Trend.DECREASING);
  }

  @Test
  @DisplayName("Constant series should be stable with zero slope and zero deviation")
  void constantSeriesIsStable() {
    var statistics =
        rateStatisticsService.analyze(
            series("1.5", "1.5", "1.5", "1.5", "1.5", "1.5", "1.5", "1.5"));

    assertThat(statistics.slope()).isEqualTo(0.0);
    assertThat(statistics.trend()).isEqualTo(Trend.STABLE);
    assertThat(statistics.standardDeviation()).isEqualTo(0.0);
    assertThat(statistics.range()).isEqualTo(0.0);
    assertThat(statistics.rollingStandardDeviation())
        .extracting(RollingWindowPoint::value)
        .containsOnly(0.0);
    // all windows tie, the earliest wins
    assertThat(statistics.volatilityPeak().date()).isEqualTo(START.plusDays(6));
  }

  @Test
  @DisplayName("Regression line should pass through the fitted points of a linear series")
  void regressionFitsLinearSeries() {
    var statistics = rateStatisticsService.analyze(series("1.00", "1.01", "1.02"));

    var first = RateStatisticsService.timestampOf(START);
    var last = RateStatisticsService.timestampOf(START.plusDays(2));

    assertThat(statistics.trendValueAt(first)).isCloseTo(1.00, within(1e-9));
    assertThat(statistics.trendValueAt(last)).isCloseTo(1.02, within(1e-9));
    assertThat(statistics.slope()).isCloseTo(0.01 / 86_400, within(1e-15));
  }

  // ===========================================================================================
  // Descriptive Statistics
  // ===========================================================================================

  @Test
  @DisplayName("Should compute mean, sample standard deviation and range")
  void shouldComputeDescriptiveStatistics() {
    var statistics = rateStatisticsService.analyze(series("1.0", "1.2", "1.4"));

    assertThat(statistics.mean()).isCloseTo(1.2, within(1e-12));
    // sample deviation: sqrt(((0.2^2) * 2) / 2) = 0.2
    assertThat(statistics.standardDeviation()).isCloseTo(0.2, within(1e-12));
    assertThat(statistics.range()).isCloseTo(0.4, within(1e-12));
  }

  @Test
  @DisplayName("Ties for best and worst rate should resolve to the earliest date")
  void extremaTiesResolveToEarliestDate() {
    var statistics = rateStatisticsService.analyze(series("1.2", "1.5", "1.5", "1.1", "1.1"));

    assertThat(statistics.best())
        .isEqualTo(new RatePoint(START.plusDays(1), new BigDecimal("1.5")));
    assertThat(statistics.worst())
        .isEqualTo(new RatePoint(START.plusDays(3), new BigDecimal("1.1")));
  }

  @Test
  @DisplayName("Extrema tied with the first day should resolve to the first day")
  void extremaTiesWithFirstDay() {
    var statistics = rateStatisticsService.analyze(series("1.5", "1.2", "1.5", "1.2"));

    assertThat(statistics.best()).isEqualTo(new RatePoint(START, new BigDecimal("1.5")));
    assertThat(statistics.worst())
        .isEqualTo(new RatePoint(START.plusDays(1), new BigDecimal("1.2")));
  }

  // ===========================================================================================
  // Rolling Window
  // ===========================================================================================

  @Test
  @DisplayName("Rolling statistics should cover complete windows only")
  void rollingStatisticsCoverCompleteWindowsOnly() {
    var statistics =
        rateStatisticsService.analyze(
            series("1.0", "1.0", "1.0", "1.0", "1.0", "1.0", "1.7", "1.0", "1.0"));

    assertThat(statistics.rollingWindow()).isEqualTo(7);
    assertThat(statistics.rollingMean())
        .extracting(RollingWindowPoint::date)
        .containsExactly(START.plusDays(6), START.plusDays(7), START.plusDays(8));
    assertThat(statistics.rollingMean().get(0).value()).isCloseTo(1.1, within(1e-12));
    assertThat(statistics.rollingStandardDeviation()).hasSize(3);
  }

  @Test
  @DisplayName("Volatility peak should be the day with the largest rolling deviation")
  void volatilityPeakIsLargestRollingDeviation() {
    var statistics =
        rateStatisticsService.analyze(
            series("1.0", "1.0", "1.0", "1.0", "1.0", "1.0", "1.0", "1.0", "1.5"));

    // only the last window holds the spike
    assertThat(statistics.findVolatilityPeak())
        .get()
        .extracting(RollingWindowPoint::date)
        .isEqualTo(START.plusDays(8));
  }

  @Test
  @DisplayName("Equal rolling deviations should resolve the volatility peak to the earliest date")
  void volatilityPeakTiesResolveToEarliestDate() {
    var properties = new RateAnalyzerProperties();
    properties.getAnalysis().setRollingWindow(2);
    var service = new RateStatisticsService(properties);

    // every window holds {1.0, 1.5}, so all three deviations are identical
    var statistics = service.analyze(series("1.0", "1.5", "1.0", "1.5"));

    assertThat(statistics.rollingStandardDeviation())
        .extracting(RollingWindowPoint::value)
        .containsOnly(statistics.rollingStandardDeviation().get(0).value());
    assertThat(statistics.rollingStandardDeviation()).hasSize(3);
    assertThat(statistics.volatilityPeak().date()).isEqualTo(START.plusDays(1));
  }

  @Test
  @DisplayName("Series shorter than the window should have no rolling statistics")
  void shortSeriesHasNoRollingStatistics() {
    var statistics = rateStatisticsService.analyze(series("1.0", "1.1", "1.2"));

    assertThat(statistics.rollingMean()).isEmpty();
    assertThat(statistics.rollingStandardDeviation()).isEmpty();
    assertThat(statistics.findVolatilityPeak()).isEmpty();
  }

  @Test
  @DisplayName("Rolling window size should come from configuration")
  void rollingWindowFromConfiguration() {
    var properties = new RateAnalyzerProperties();
    properties.getAnalysis().setRollingWindow(2);
    var service = new RateStatisticsService(properties);

    var statistics = service.analyze(series("1.0", "1.2", "1.2"));

    assertThat(statistics.rollingStandardDeviation())
        .extracting(RollingWindowPoint::date)
        .containsExactly(START.plusDays(1), START.plusDays(2));
    assertThat(statistics.volatilityPeak().date()).isEqualTo(START.plusDays(1));
  }

  // ===========================================================================================
  // Edge Cases
  // ===========================================================================================

  @Test
  @DisplayName("Single point should be stable with its rate as intercept")
  void singlePointIsStable() {
    var statistics = rateStatisticsService.analyze(series("1.072039"));

    assertThat(statistics.slope()).isEqualTo(0.0);
    assertThat(statistics.intercept()).isEqualTo(1.072039);
    assertThat(statistics.trend()).isEqualTo(Trend.STABLE);
    assertThat(statistics.best()).isEqualTo(statistics.worst());
    assertThat(statistics.standardDeviation()).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should reject an empty series")
  void shouldRejectEmptySeries() {
    assertThatThrownBy(() -> rateStatisticsService.analyze(RateSeries.empty()))
        .isInstanceOf(BusinessException.class)
        .hasMessageContaining("empty");
  }

  private static RateSeries series(String... rates) {
    var points = new ArrayList<RatePoint>();
    for (int i = 0; i < rates.length; i++) {
      points.add(new RatePoint(START.plusDays(i), new BigDecimal(rates[i])));
    }
    return RateSeries.of(points);
  }
}
