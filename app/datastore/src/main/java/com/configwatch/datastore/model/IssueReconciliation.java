/*
 * Where: Datastore domain model
 * What: Issues added and removed by one reconciliation pass
 */
package com.configwatch.datastore.model;

import java.util.List;

public record IssueReconciliation(List<AuditIssue> added, List<IssueRecord> removed) {

  public IssueReconciliation {
    added = List.copyOf(added);
    removed = List.copyOf(removed);
  }

  public static IssueReconciliation none() {
    return new IssueReconciliation(List.of(), List.of());
  }
}
