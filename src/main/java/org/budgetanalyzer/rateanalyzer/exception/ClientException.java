package org.budgetanalyzer.rateanalyzer.exception;

/** Unexpected failure inside an HTTP client that is neither a transport nor a provider error. */
public class ClientException extends ServiceException {

  public ClientException(String message) {
    super(message);
  }

  public ClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
