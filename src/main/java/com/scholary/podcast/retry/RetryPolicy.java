package com.scholary.podcast.retry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff.
 *
 * <p>Only failures the caller classifies as transient are retried; anything else propagates on the
 * first attempt. With the defaults (3 attempts, 2s initial backoff, multiplier 2) the waits are 2s
 * then 4s. Once attempts are exhausted the last failure propagates unchanged.
 */
public class RetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final double multiplier;
  private final Sleeper sleeper;

  public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
    this(maxAttempts, initialBackoff, multiplier, Sleeper.THREAD);
  }

  public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.multiplier = multiplier;
    this.sleeper = sleeper;
  }

  /**
   * Run the work, retrying transient failures.
   *
   * @param operation short description used in log lines
   * @param work the call to make; must be safe to repeat
   * @param isTransient classifies failures that deserve another attempt
   * @return the work's result
   * @throws RuntimeException the last failure, unwrapped if it was unchecked
   * @throws RetryInterruptedException if interrupted while backing off
   */
  public <T> T execute(String operation, Callable<T> work, Predicate<Throwable> isTransient) {
    Duration backoff = initialBackoff;
    int attempt = 0;

    while (true) {
      attempt++;
      try {
        return work.call();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RetryInterruptedException(operation, e);
      } catch (Exception e) {
        if (!isTransient.test(e) || attempt >= maxAttempts) {
          if (attempt > 1) {
            LOGGER.warn(
                "{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
          }
          throw propagate(e);
        }

        LOGGER.warn(
            "{} attempt {}/{} failed, retrying in {}ms: {}",
            operation,
            attempt,
            maxAttempts,
            backoff.toMillis(),
            e.getMessage());
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RetryInterruptedException(operation, ie);
        }
        backoff = Duration.ofMillis((long) (backoff.toMillis() * multiplier));
      }
    }
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private static RuntimeException propagate(Exception e) {
    if (e instanceof RuntimeException) {
      return (RuntimeException) e;
    }
    return new IllegalStateException(e.getMessage(), e);
  }
}
