/*
 * Where: Datastore domain model
 * What: An audit finding supplied by a watcher for the current snapshot
 * Why: Input side of issue reconciliation; stored rows are IssueRecord
 */
package com.configwatch.datastore.model;

public record AuditIssue(int score, String issue, String notes) {

  public IssueKey key() {
    return new IssueKey(issue, notes);
  }
}
