/*
 * Where: Datastore domain model
 * What: Outcome of a store call
 */
package com.configwatch.datastore.model;

public record StoredRevision(
    ItemRecord item, RevisionRecord revision, boolean newRevision, IssueReconciliation issues) {}
