/*
 * Where: Change detection tests
 * What: Verifies the per technology ephemeral path table
 */
package com.configwatch.datastore.change;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EphemeralPathFilterTest {

  private final EphemeralPathFilter filter = new EphemeralPathFilter();

  @Test
  void knownTechnologiesHaveTheirPaths() {
    assertThat(filter.pathsFor("securitygroup"))
        .extracting(EphemeralPath::expression)
        .containsExactly("assigned_to");
    assertThat(filter.pathsFor("iamuser")).hasSize(4);
    assertThat(filter.pathsFor("redshift"))
        .extracting(EphemeralPath::expression)
        .contains("RestoreStatus", "ClusterStatus", "ClusterRevisionNumber");
  }

  @Test
  void unknownOrMissingTechnologyHasNoPaths() {
    assertThat(filter.pathsFor("s3")).isEmpty();
    assertThat(filter.pathsFor(null)).isEmpty();
  }
}
