/*
 * Where: Change detection
 * What: Per technology table of ephemeral paths
 * Why: These fields move on every poll without a real configuration change
 */
package com.configwatch.datastore.change;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class EphemeralPathFilter {

  private static final Map<String, List<EphemeralPath>> PATHS_BY_TECHNOLOGY =
      Map.of(
          "redshift",
          paths(
              "RestoreStatus",
              "ClusterStatus",
              "ClusterParameterGroups[*].ParameterApplyStatus",
              "ClusterParameterGroups[*].ClusterParameterStatusList[*].ParameterApplyErrorDescription",
              "ClusterParameterGroups[*].ClusterParameterStatusList[*].ParameterApplyStatus",
              "ClusterRevisionNumber"),
          "securitygroup",
          paths("assigned_to"),
          "iamuser",
          paths(
              "user.password_last_used",
              "accesskeys[*].LastUsedDate",
              "accesskeys[*].Region",
              "accesskeys[*].ServiceName"));

  /** Returns the ephemeral paths of a technology; unknown technologies have none. */
  public List<EphemeralPath> pathsFor(String technology) {
    if (technology == null) {
      return List.of();
    }
    return PATHS_BY_TECHNOLOGY.getOrDefault(technology, List.of());
  }

  private static List<EphemeralPath> paths(String... expressions) {
    return Arrays.stream(expressions).map(EphemeralPath::parse).toList();
  }
}
