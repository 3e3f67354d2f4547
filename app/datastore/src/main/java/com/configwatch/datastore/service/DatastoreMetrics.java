/*
 * Where: Datastore service layer
 * What: Records store outcomes, exhausted read retries and exception ledger writes
 * Why: Watcher runs are unattended; these counters show when storage starts failing
 */
package com.configwatch.datastore.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class DatastoreMetrics {

  static final String MODE_REVISION = "revision";
  static final String MODE_EPHEMERAL = "ephemeral";
  static final String RESULT_SUCCESS = "success";
  static final String RESULT_FAILURE = "failure";

  private static final String METRIC_STORE_TOTAL = "datastore.store.total";
  private static final String METRIC_RETRY_EXHAUSTED = "datastore.retry.exhausted";
  private static final String METRIC_EXCEPTIONS_RECORDED = "datastore.exceptions.recorded";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public DatastoreMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordStore(String mode, String result) {
    increment(
        METRIC_STORE_TOTAL,
        "Snapshot store outcomes",
        Tags.of("mode", mode, "result", result));
  }

  public void recordRetryExhausted(String operation) {
    increment(
        METRIC_RETRY_EXHAUSTED,
        "Reads that failed after every retry attempt",
        Tags.of("operation", operation));
  }

  public void recordException(String result) {
    increment(
        METRIC_EXCEPTIONS_RECORDED,
        "Exception ledger write outcomes",
        Tags.of("result", result));
  }

  private void increment(String name, String description, Tags tags) {
    counters
        .computeIfAbsent(
            name + tags,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
