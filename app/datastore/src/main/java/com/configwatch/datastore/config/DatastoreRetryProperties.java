/*
 * Where: Datastore application configuration binding
 * What: Holds retry settings for reads that may hit transient storage failures
 * Why: Attempt count and delay differ between local runs and production pools
 */
package com.configwatch.datastore.config;

import com.configwatch.datastore.service.RetryPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "datastore.retry")
@Validated
public record DatastoreRetryProperties(
    @Min(1) int maxAttempts,
    @NotNull Duration delay,
    @DecimalMin("1.0") double backoffMultiplier) {

  @AssertTrue(message = "datastore.retry.delay must not be negative")
  public boolean isDelayNotNegative() {
    // null is reported by @NotNull
    return delay == null || !delay.isNegative();
  }

  public RetryPolicy toPolicy() {
    return new RetryPolicy(maxAttempts, delay, backoffMultiplier);
  }
}
