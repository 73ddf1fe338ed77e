package com.scholary.videoask.handler.retry;

import com.scholary.videoask.handler.logging.StructuredLogger;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry with exponential backoff for a single outbound call site.
 *
 * <p>The wait before attempt {@code n} (n &gt;= 2) is {@code initialBackoff * multiplier^(n-2)},
 * so three attempts with a 1s initial backoff and multiplier 2 wait 1s and then 2s. Only failures
 * accepted by the retryable predicate are retried; anything else, and the failure of the last
 * attempt, propagates unchanged.
 */
public final class RetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final double multiplier;
  private final Predicate<RuntimeException> retryable;
  private final Sleeper sleeper;

  public RetryPolicy(
      int maxAttempts,
      Duration initialBackoff,
      double multiplier,
      Predicate<RuntimeException> retryable,
      Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.multiplier = multiplier;
    this.retryable = retryable;
    this.sleeper = sleeper;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Wait before the given attempt (1-based). The first attempt never waits. */
  public Duration backoffBefore(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    double factor = Math.pow(multiplier, attempt - 2);
    return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
  }

  /**
   * Run the action, retrying retryable failures.
   *
   * @param operation name used in log events
   * @param action the call to make
   * @return the action's result
   */
  public <T> T execute(String operation, Supplier<T> action) {
    int attempt = 1;
    while (true) {
      try {
        return action.get();
      } catch (RuntimeException e) {
        String errorType = e.getClass().getSimpleName();
        if (!retryable.test(e)) {
          throw e;
        }
        if (attempt >= maxAttempts) {
          structuredLogger.logCallFailed(operation, attempt, errorType, e.getMessage());
          throw e;
        }
        attempt++;
        Duration backoff = backoffBefore(attempt);
        structuredLogger.logRetry(
            operation, attempt, maxAttempts, backoff.toMillis(), errorType, e.getMessage());
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
      }
    }
  }
}
