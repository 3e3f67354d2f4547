/*
 * Where: Datastore service tests
 * What: Verifies which failures are retried, the attempt ceiling and the backoff schedule
 * Why: Retrying a logical failure would hide bugs; never retrying would fail on pool timeouts
 */
package com.configwatch.datastore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

class RetryPolicyTest {

  private final RetryPolicy policy = RetryPolicy.fixed(3, Duration.ZERO);

  @Test
  void returnsResultAfterTransientFailures() {
    final AtomicInteger calls = new AtomicInteger();

    final String result =
        policy.call(
            "listing",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new TransientDataAccessResourceException("pool exhausted");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
  }

  @Test
  void logicalFailurePropagatesWithoutRetry() {
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.call(
                    "listing",
                    () -> {
                      calls.incrementAndGet();
                      throw new DataIntegrityViolationException("broken row");
                    }))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void exhaustionCarriesOperationAttemptsAndLastCause() {
    final QueryTimeoutException lastFailure = new QueryTimeoutException("still slow");

    assertThatThrownBy(
            () ->
                policy.call(
                    "getAllFiltered",
                    () -> {
                      throw lastFailure;
                    }))
        .isInstanceOfSatisfying(
            RetryExhaustedException.class,
            ex -> {
              assertThat(ex.getOperation()).isEqualTo("getAllFiltered");
              assertThat(ex.getAttempts()).isEqualTo(3);
              assertThat(ex.getCause()).isSameAs(lastFailure);
            });
  }

  @Test
  void connectionFailuresAreTransient() {
    assertThat(RetryPolicy.isTransient(new CannotGetJdbcConnectionException("no connection")))
        .isTrue();
    assertThat(RetryPolicy.isTransient(new IllegalStateException("bug"))).isFalse();
  }

  @Test
  void fixedPolicyWaitsTheSameBeforeEveryRetry() {
    final RetryPolicy fixed = RetryPolicy.fixed(5, Duration.ofSeconds(5));

    assertThat(fixed.delayBefore(1)).isZero();
    assertThat(fixed.delayBefore(2)).isEqualTo(Duration.ofSeconds(5));
    assertThat(fixed.delayBefore(5)).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void multiplierGrowsTheDelayGeometrically() {
    final RetryPolicy backoff = new RetryPolicy(4, Duration.ofMillis(100), 2.0d);

    assertThat(backoff.delayBefore(2)).isEqualTo(Duration.ofMillis(100));
    assertThat(backoff.delayBefore(3)).isEqualTo(Duration.ofMillis(200));
    assertThat(backoff.delayBefore(4)).isEqualTo(Duration.ofMillis(400));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThatThrownBy(() -> RetryPolicy.fixed(0, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetryPolicy.fixed(1, Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, 0.5d))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void interruptionWhileWaitingStopsRetryingAndKeepsTheFlag() {
    final RetryPolicy waiting = RetryPolicy.fixed(3, Duration.ofSeconds(1));
    Thread.currentThread().interrupt();

    try {
      assertThatThrownBy(
              () ->
                  waiting.call(
                      "listing",
                      () -> {
                        throw new TransientDataAccessResourceException("down");
                      }))
          .isInstanceOf(RetryExhaustedException.class)
          .hasCauseInstanceOf(InterruptedException.class);
    } finally {
      assertThat(Thread.interrupted()).isTrue();
    }
  }
}
