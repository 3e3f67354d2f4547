/*
 * Where: Datastore domain model
 * What: One snapshot delivered by a watcher for a single resource
 * Why: Groups the store inputs so the issue list is always an owned copy
 */
package com.configwatch.datastore.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record StoreRequest(
    String technology,
    String region,
    String account,
    String name,
    boolean active,
    JsonNode config,
    String arn,
    List<AuditIssue> newIssues,
    boolean ephemeral) {

  public StoreRequest {
    // null and empty mean the same thing; the caller's list is never retained
    newIssues = copyIssues(newIssues);
  }

  public static StoreRequest of(
      String technology, String region, String account, String name, boolean active, JsonNode config) {
    return new StoreRequest(technology, region, account, name, active, config, null, List.of(), false);
  }

  private static List<AuditIssue> copyIssues(List<AuditIssue> newIssues) {
    if (newIssues == null) {
      return List.of();
    }
    // contains(null) throws on immutable lists
    for (AuditIssue issue : newIssues) {
      if (issue == null) {
        throw new IllegalArgumentException("newIssues must not contain null elements");
      }
    }
    return List.copyOf(newIssues);
  }
}
