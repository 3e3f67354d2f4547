/*
 * Where: Datastore configuration binding tests
 * What: Verifies retry and exception ledger settings bind and validate
 * Why: A bad retry or ttl setting must stop startup instead of misbehaving at runtime
 */
package com.configwatch.datastore.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.configwatch.datastore.service.RetryPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

class DatastorePropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsRetryLedgerAndRetentionSettings() {
    contextRunner
        .withPropertyValues(
            "datastore.retry.max-attempts=5",
            "datastore.retry.delay=5s",
            "datastore.retry.backoff-multiplier=1.0",
            "datastore.exceptions.default-ttl=10d",
            "datastore.exceptions.retention.enabled=true",
            "datastore.exceptions.retention.cleanup-interval=1h")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final RetryPolicy policy = context.getBean(RetryPolicy.class);
              assertThat(policy.maxAttempts()).isEqualTo(5);
              assertThat(policy.delay()).isEqualTo(Duration.ofSeconds(5));
              assertThat(context.getBean(ExceptionLedgerProperties.class).defaultTtl())
                  .isEqualTo(Duration.ofDays(10));
              final ExceptionRetentionProperties retention =
                  context.getBean(ExceptionRetentionProperties.class);
              assertThat(retention.enabled()).isTrue();
              assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(1));
            });
  }

  @Test
  void rejectsZeroAttempts() {
    contextRunner
        .withPropertyValues(
            "datastore.retry.max-attempts=0",
            "datastore.retry.delay=5s",
            "datastore.retry.backoff-multiplier=1.0",
            "datastore.exceptions.default-ttl=10d")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsMissingDefaultTtl() {
    contextRunner
        .withPropertyValues(
            "datastore.retry.max-attempts=5",
            "datastore.retry.delay=5s",
            "datastore.retry.backoff-multiplier=1.0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    DatastoreRetryProperties.class,
    ExceptionLedgerProperties.class,
    ExceptionRetentionProperties.class
  })
  @Import(DatastoreConfig.class)
  static class TestConfiguration {
    // minimal setup for ApplicationContextRunner
  }
}
