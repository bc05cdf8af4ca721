package org.budgetanalyzer.rateanalyzer.service;

import java.util.ArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.rateanalyzer.domain.RatePoint;
import org.budgetanalyzer.rateanalyzer.domain.RateSeries;
import org.budgetanalyzer.rateanalyzer.exception.BusinessException;
import org.budgetanalyzer.rateanalyzer.exception.RateAnalyzerError;

/**
 * Turns a series with gaps into a dense daily series.
 *
 * <p>The output has one point for every calendar day from the first to the last date of the input.
 * A missing day takes the rate of the closest earlier day (forward fill). The first day always has
 * a rate of its own, so no backward fill is ever needed.
 */
@Service
public class SeriesNormalizer {

  private static final Logger log = LoggerFactory.getLogger(SeriesNormalizer.class);

  /**
   * Reindexes a series to one point per day.
   *
   * @param series the series to normalize
   * @return the dense series
   * @throws BusinessException with code {@link RateAnalyzerError#EMPTY_SERIES} if the series is
   *     empty
   */
  public RateSeries normalize(RateSeries series) {
    if (series.isEmpty()) {
      throw new BusinessException(
          "Cannot normalize an empty rate series", RateAnalyzerError.EMPTY_SERIES.name());
    }

    if (series.isContiguous()) {
      return series;
    }

    var pointsByDate =
        series.points().stream().collect(Collectors.toMap(RatePoint::date, Function.identity()));

    var effectiveStartDate = series.first().date();
    var effectiveEndDate = series.last().date();

    var rv = new ArrayList<RatePoint>();
    var currentPoint = series.first();
    var filled = 0;

    for (var date = effectiveStartDate; !date.isAfter(effectiveEndDate); date = date.plusDays(1)) {
      if (pointsByDate.containsKey(date)) {
        currentPoint = pointsByDate.get(date);
        rv.add(currentPoint);
      } else {
        rv.add(currentPoint.withDate(date));
        filled++;
      }
    }

    if (filled > 0) {
      log.info(
          "Forward filled {} missing day(s) between {} and {}",
          filled,
          effectiveStartDate,
          effectiveEndDate);
    }

    return RateSeries.of(rv);
  }
}
