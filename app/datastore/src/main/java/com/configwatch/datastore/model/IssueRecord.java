/*
 * Where: Datastore domain model
 * What: An audit issue row attached to an item
 * Why: Justification fields survive reconciliation because identity is (issue, notes)
 */
package com.configwatch.datastore.model;

import java.time.Instant;

public record IssueRecord(
    long id,
    long itemId,
    int score,
    String issue,
    String notes,
    boolean justified,
    String justification,
    String justifiedBy,
    Instant justifiedDate) {

  public IssueKey key() {
    return new IssueKey(issue, notes);
  }
}
