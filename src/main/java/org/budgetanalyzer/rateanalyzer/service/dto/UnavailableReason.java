package org.budgetanalyzer.rateanalyzer.service.dto;

/** Why no rate could be obtained for a day. */
public enum UnavailableReason {
  /** Every attempt hit a transport-level failure. */
  RETRIES_EXHAUSTED,

  /** The provider answered with an error; not retried. */
  PROVIDER_ERROR,

  /** The provider answered successfully without a usable rate for the target currency. */
  MISSING_RATE,

  /** The thread was interrupted while waiting to retry. */
  INTERRUPTED,
}
