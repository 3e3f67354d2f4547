/*
 * Where: Datastore metrics tests
 * What: Verifies store, retry and ledger counters are registered with their tags
 * Why: Dashboards key on these names; renames must be deliberate
 */
package com.configwatch.datastore.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class DatastoreMetricsTest {

  @Test
  void recordsTaggedCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DatastoreMetrics metrics = new DatastoreMetrics(registry);

    metrics.recordStore("revision", "success");
    metrics.recordStore("revision", "success");
    metrics.recordStore("ephemeral", "failure");
    metrics.recordRetryExhausted("getAllFiltered");
    metrics.recordException("failure");

    assertThat(
            registry
                .get("datastore.store.total")
                .tags("mode", "revision", "result", "success")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("datastore.store.total")
                .tags("mode", "ephemeral", "result", "failure")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("datastore.retry.exhausted").tag("operation", "getAllFiltered").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("datastore.exceptions.recorded").tag("result", "failure").counter().count())
        .isEqualTo(1.0d);
  }
}
