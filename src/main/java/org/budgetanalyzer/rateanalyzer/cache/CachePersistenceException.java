package org.budgetanalyzer.rateanalyzer.cache;

import org.budgetanalyzer.rateanalyzer.exception.ServiceException;

/**
 * The durable cache file could not be read or written.
 *
 * <p>Never caught by the pipeline: a run that cannot persist what it fetched stops.
 */
public class CachePersistenceException extends ServiceException {

  public CachePersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
