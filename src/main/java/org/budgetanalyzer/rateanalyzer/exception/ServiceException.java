package org.budgetanalyzer.rateanalyzer.exception;

/** Base class for unchecked failures raised by the rate analyzer. */
public class ServiceException extends RuntimeException {

  public ServiceException(String message) {
    super(message);
  }

  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
