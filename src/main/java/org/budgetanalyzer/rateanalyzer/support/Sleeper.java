package org.budgetanalyzer.rateanalyzer.support;

import java.time.Duration;

/** Blocks the calling thread between retry attempts. */
@FunctionalInterface
public interface Sleeper {

  /**
   * Blocks for the given duration.
   *
   * @param duration how long to wait
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(Duration duration) throws InterruptedException;

  /**
   * Returns a sleeper backed by {@link Thread#sleep(long)}.
   *
   * @return the production sleeper
   */
  static Sleeper threadSleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
