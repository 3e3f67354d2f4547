/*
 * Where: Datastore application configuration binding
 * What: Holds the default lifetime of exception ledger records
 * Why: Diagnostic records are kept longer in production than in test environments
 */
package com.configwatch.datastore.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "datastore.exceptions")
@Validated
public record ExceptionLedgerProperties(@NotNull Duration defaultTtl) {

  @AssertTrue(message = "datastore.exceptions.default-ttl must be positive")
  public boolean isDefaultTtlPositive() {
    return defaultTtl == null || (!defaultTtl.isZero() && !defaultTtl.isNegative());
  }
}
