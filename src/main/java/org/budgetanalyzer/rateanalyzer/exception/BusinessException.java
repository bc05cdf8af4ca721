package org.budgetanalyzer.rateanalyzer.exception;

/**
 * Raised when an operation cannot proceed because of the data it was given.
 *
 * <p>The {@code code} is the name of a {@link RateAnalyzerError} so callers can branch on it
 * without parsing messages.
 */
public class BusinessException extends ServiceException {

  private final String code;

  public BusinessException(String message, String code) {
    super(message);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
