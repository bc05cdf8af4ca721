package org.budgetanalyzer.rateanalyzer.domain;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable sequence of daily rates ordered by date.
 *
 * <p>Dates are strictly increasing, so a series never holds two points for the same day. Gaps
 * between days are allowed until the series has been normalized.
 */
public final class RateSeries implements Iterable<RatePoint> {

  private static final RateSeries EMPTY = new RateSeries(List.of());

  private final List<RatePoint> points;

  private RateSeries(List<RatePoint> points) {
    this.points = points;
  }

  public static RateSeries empty() {
    return EMPTY;
  }

  /**
   * Creates a series from points already in ascending date order.
   *
   * @param points the points, strictly increasing by date
   * @return the series
   * @throws IllegalArgumentException if the points are out of order or repeat a date
   */
  public static RateSeries of(List<RatePoint> points) {
    var copy = List.copyOf(points);
    for (int i = 1; i < copy.size(); i++) {
      var previous = copy.get(i - 1).date();
      var current = copy.get(i).date();
      if (!current.isAfter(previous)) {
        throw new IllegalArgumentException(
            "Series dates must be strictly increasing: " + previous + " then " + current);
      }
    }
    return copy.isEmpty() ? EMPTY : new RateSeries(copy);
  }

  /**
   * Creates a series from points in any order.
   *
   * @param points the points, at most one per date
   * @return the series sorted by date
   */
  public static RateSeries sortedOf(Collection<RatePoint> points) {
    var sorted = new ArrayList<>(points);
    sorted.sort(Comparator.comparing(RatePoint::date));
    return of(sorted);
  }

  public List<RatePoint> points() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public RatePoint get(int index) {
    return points.get(index);
  }

  public RatePoint first() {
    return points.get(0);
  }

  public RatePoint last() {
    return points.get(points.size() - 1);
  }

  /** Returns true if every calendar day between the first and last date has a point. */
  public boolean isContiguous() {
    if (points.isEmpty()) {
      return true;
    }
    return ChronoUnit.DAYS.between(first().date(), last().date()) + 1 == points.size();
  }

  public double[] rates() {
    return points.stream().mapToDouble(point -> point.rate().doubleValue()).toArray();
  }

  @Override
  public Iterator<RatePoint> iterator() {
    return points.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof RateSeries other && points.equals(other.points);
  }

  @Override
  public int hashCode() {
    return points.hashCode();
  }

  @Override
  public String toString() {
    if (points.isEmpty()) {
      return "RateSeries[]";
    }
    return "RateSeries[" + first().date() + ".." + last().date() + ", " + size() + " points]";
  }
}
