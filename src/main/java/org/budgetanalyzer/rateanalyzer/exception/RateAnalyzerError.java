package org.budgetanalyzer.rateanalyzer.exception;

/** Error codes for rate analyzer business exceptions. */
public enum RateAnalyzerError {
  /** A series was expected to hold at least one point but was empty. */
  EMPTY_SERIES,
}
