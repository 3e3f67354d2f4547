/*
 * Where: Datastore service layer
 * What: Bounded retry for read queries that hit transient storage failures
 * Why: Pooled connections time out under load; logical failures must still fail fast
 */
package com.configwatch.datastore.service;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Retry settings as a value. {@code backoffMultiplier == 1.0} gives a fixed delay between
 * attempts; larger values grow the delay geometrically.
 *
 * <p>Only the filtered item listing is wrapped. Other reads and every write fail on the first
 * error.
 */
public record RetryPolicy(int maxAttempts, Duration delay, double backoffMultiplier) {

  private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (delay == null || delay.isNegative()) {
      throw new IllegalArgumentException("delay must be zero or positive");
    }
    if (backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
    }
  }

  public static RetryPolicy fixed(int maxAttempts, Duration delay) {
    return new RetryPolicy(maxAttempts, delay, 1.0d);
  }

  public <T> T call(String operation, Supplier<T> action) {
    RuntimeException lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return action.get();
      } catch (RuntimeException ex) {
        if (!isTransient(ex)) {
          throw ex;
        }
        lastFailure = ex;
        logger.warn(
            "transient storage failure operation={} attempt={} maxAttempts={}",
            operation,
            attempt,
            maxAttempts);
        logger.debug("transient storage failure detail operation={}", operation, ex);
        if (attempt < maxAttempts) {
          sleep(operation, attempt, delayBefore(attempt + 1));
        }
      }
    }
    throw new RetryExhaustedException(operation, maxAttempts, lastFailure);
  }

  Duration delayBefore(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    final double factor = Math.pow(backoffMultiplier, attempt - 2);
    return Duration.ofMillis((long) Math.ceil(delay.toMillis() * factor));
  }

  static boolean isTransient(Throwable ex) {
    // CannotGetJdbcConnectionException is a DataAccessResourceFailureException
    return ex instanceof TransientDataAccessException
        || ex instanceof RecoverableDataAccessException
        || ex instanceof DataAccessResourceFailureException;
  }

  private void sleep(String operation, int attempt, Duration wait) {
    if (wait.isZero()) {
      return;
    }
    try {
      Thread.sleep(wait.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RetryExhaustedException(operation, attempt, ex);
    }
  }
}
