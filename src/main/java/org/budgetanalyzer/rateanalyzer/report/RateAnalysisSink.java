package org.budgetanalyzer.rateanalyzer.report;

import org.budgetanalyzer.rateanalyzer.domain.RateSeries;
import org.budgetanalyzer.rateanalyzer.service.dto.RateStatistics;

/**
 * Consumer of a finished analysis, e.g. a report writer or a chart renderer.
 *
 * <p>Sinks only read what they are given; nothing flows back into the pipeline.
 */
public interface RateAnalysisSink {

  /**
   * Receives the analyzed series and its statistics.
   *
   * @param series the normalized series
   * @param statistics statistics computed over {@code series}
   */
  void accept(RateSeries series, RateStatistics statistics);
}
